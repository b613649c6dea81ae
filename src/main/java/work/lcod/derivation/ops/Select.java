package work.lcod.derivation.ops;

import java.util.Objects;
import java.util.Optional;
import work.lcod.derivation.state.DerivationStep;
import work.lcod.derivation.state.Lexicon;
import work.lcod.derivation.state.ResourceSpace;
import work.lcod.derivation.syntax.Merge;
import work.lcod.derivation.syntax.Preorder;
import work.lcod.derivation.syntax.SyntacticObject;

/**
 * State transitions of a derivation: lexical insertion and the three select operations.
 * Every method is pure; failures leave the input step untouched and surface as {@link DerivationException}.
 */
public final class Select {
    private Select() {}

    /**
     * Prepends {@code Terminal(lexicon[index])} to the resource space.
     */
    public static ResourceSpace insert(Lexicon lexicon, int index, ResourceSpace resources) {
        Objects.requireNonNull(lexicon, "lexicon");
        Objects.requireNonNull(resources, "resources");
        if (!lexicon.contains(index)) {
            throw DerivationException.invalidLexiconIndex(index, lexicon.size());
        }
        return resources.prepend(SyntacticObject.terminal(lexicon.get(index)));
    }

    /**
     * External merge (select1): moves {@code resources[n]} into the operating space.
     */
    public static DerivationStep external(int n, DerivationStep step) {
        var resources = step.resources();
        if (!resources.contains(n)) {
            throw DerivationException.indexOutOfRange(n, resources.size());
        }
        var selected = resources.get(n);
        return new DerivationStep(resources.removeAt(n), Optional.of(Merge.merge(selected, step.operating())));
    }

    /**
     * Internal merge (select2): re-merges the constituent at preorder position {@code n} with the whole
     * operating object. The original occurrence stays in place; {@code n = 0} merges the object with itself.
     */
    public static DerivationStep internal(int n, DerivationStep step) {
        var operating = requireOperating(step);
        var target = constituentAt(operating, n);
        return step.withOperating(Optional.of(Merge.merge(target, step.operating())));
    }

    /**
     * Spellout (select3): pushes the constituent at preorder position {@code n} back into the resource
     * space as one unit and removes it from the operating space.
     */
    public static DerivationStep spellout(int n, DerivationStep step) {
        var operating = requireOperating(step);
        var xp = constituentAt(operating, n);
        return new DerivationStep(step.resources().prepend(xp), remove(xp, step.operating()));
    }

    /**
     * Shallow removal: only the whole object or, for a binary node, one of its immediate daughters
     * can be removed. A unary node is never searched below itself.
     */
    public static Optional<SyntacticObject> remove(SyntacticObject xp, Optional<SyntacticObject> operating) {
        Objects.requireNonNull(xp, "xp");
        if (operating.isEmpty()) {
            return Optional.empty();
        }
        var so = operating.get();
        if (so.equals(xp)) {
            return Optional.empty();
        }
        if (so instanceof SyntacticObject.Binary binary) {
            if (binary.left().equals(xp)) {
                return Optional.of(binary.right());
            }
            if (binary.right().equals(xp)) {
                return Optional.of(binary.left());
            }
            throw DerivationException.constituentNotFound(xp);
        }
        return operating;
    }

    private static SyntacticObject requireOperating(DerivationStep step) {
        return step.operating().orElseThrow(DerivationException::emptyOperatingSpace);
    }

    private static SyntacticObject constituentAt(SyntacticObject operating, int n) {
        return Preorder.at(operating, n)
            .orElseThrow(() -> DerivationException.indexOutOfRange(n, Preorder.nodeCount(operating)));
    }
}
