package work.lcod.derivation.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.derivation.syntax.SyntacticObject.binary;
import static work.lcod.derivation.syntax.SyntacticObject.terminal;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.derivation.render.Bracket;
import work.lcod.derivation.state.Lexicon;

class DerivationTest {
    @Test
    void pureExternalMerge() {
        var derivation = Derivation.start(Lexicon.of("John", "left"))
            .insert(0)
            .insert(1);
        assertEquals(List.of(terminal("left"), terminal("John")), derivation.current().resources().asList());

        derivation.selectExternal(0).selectExternal(0);
        assertTrue(derivation.isComplete());
        assertEquals("[ John [ left ] ]", Bracket.render(derivation.operating().orElseThrow()));
    }

    @Test
    void movementCopiesConstituentToRoot() {
        var derivation = Derivation.start(Lexicon.of("John", "likes", "who"))
            .insert(0)
            .insert(1)
            .insert(2)
            .selectExternal(0)
            .selectExternal(0)
            .selectExternal(0);
        assertEquals(
            Optional.of(binary(terminal("John"), binary(terminal("likes"), terminal("who")))),
            derivation.operating()
        );

        derivation.selectInternal(4);
        assertEquals("[ who [ John [ likes [ who ] ] ] ]", Bracket.render(derivation.operating().orElseThrow()));
        assertTrue(derivation.isComplete());
    }

    @Test
    void spelloutTurnsSpecifierIntoSingleUnit() {
        var derivation = Derivation.start(Lexicon.of("the", "boy", "like", "who"))
            .insert(0)
            .insert(1)
            .insert(2)
            .insert(3)
            .selectExternal(2)
            .selectExternal(2);
        var specifier = binary(terminal("the"), terminal("boy"));
        assertEquals(Optional.of(specifier), derivation.operating());

        derivation.selectSpellout(0);
        assertTrue(derivation.operating().isEmpty());
        assertEquals(List.of(specifier, terminal("who"), terminal("like")), derivation.current().resources().asList());

        derivation.selectExternal(1)
            .selectExternal(1)
            .selectExternal(0)
            .selectInternal(6);
        assertEquals("[ who [ the boy [ like [ who ] ] ] ]", Bracket.render(derivation.operating().orElseThrow()));
        assertTrue(derivation.isComplete());
    }

    @Test
    void keepsHistoryOfEveryStep() {
        var derivation = Derivation.start(Lexicon.of("a", "b"))
            .apply(new Operation.Insert(0))
            .apply(new Operation.Insert(1))
            .apply(new Operation.SelectExternal(1));
        assertEquals(4, derivation.history().size());
        assertEquals(3, derivation.operations().size());
        assertEquals(Operation.SELECT_EXTERNAL, derivation.operations().get(2).id());
        assertFalse(derivation.isComplete());
    }

    @Test
    void failedOperationKeepsLastGoodStep() {
        var derivation = Derivation.start(Lexicon.of("a")).insert(0);
        var before = derivation.current();
        var ex = assertThrows(DerivationException.class, () -> derivation.selectInternal(0));
        assertEquals(ErrorKind.EMPTY_OPERATING_SPACE, ex.kind());
        assertEquals(before, derivation.current());
        assertEquals(1, derivation.operations().size());
    }
}
