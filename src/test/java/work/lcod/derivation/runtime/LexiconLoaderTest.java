package work.lcod.derivation.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class LexiconLoaderTest {
    @Test
    void readsTopLevelItems() {
        var lexicon = LexiconLoader.parse("items = [\"Mary\", \"sleeps\"]", "inline");
        assertEquals(List.of("Mary", "sleeps"), lexicon.items());
    }

    @Test
    void readsLexiconTable() {
        var lexicon = LexiconLoader.parse("[lexicon]\nitems = [\"the\", \"boy\"]\n", "inline");
        assertEquals(List.of("the", "boy"), lexicon.items());
    }

    @Test
    void loadsFile() {
        var path = Path.of("src", "test", "resources", "scripts", "alternate-lexicon.toml");
        assertEquals(2, LexiconLoader.loadFromFile(path).size());
    }

    @Test
    void rejectsInvalidLexicons() {
        assertThrows(IllegalArgumentException.class, () -> LexiconLoader.parse("items = [", "broken"));
        assertThrows(IllegalArgumentException.class, () -> LexiconLoader.parse("words = [\"a\"]", "no-items"));
        assertThrows(IllegalArgumentException.class, () -> LexiconLoader.parse("items = [1, 2]", "numbers"));
    }
}
