package work.lcod.derivation.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.derivation.state.Lexicon;

/**
 * Reads lexicons from TOML files. The item list is either a top-level {@code items} array or the
 * {@code items} array of a {@code [lexicon]} table.
 */
public final class LexiconLoader {
    private static final String ITEMS_KEY = "items";
    private static final String TABLE_KEY = "lexicon";

    private LexiconLoader() {}

    public static Lexicon loadFromFile(Path path) {
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read lexicon: " + path, ex);
        }
    }

    public static Lexicon parse(String toml, String origin) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid lexicon TOML in " + origin + ": " + errors);
        }
        TomlArray items = result.getArray(ITEMS_KEY);
        if (items == null) {
            TomlTable table = result.getTable(TABLE_KEY);
            items = table == null ? null : table.getArray(ITEMS_KEY);
        }
        if (items == null) {
            throw new IllegalArgumentException("Lexicon " + origin + " has no '" + ITEMS_KEY + "' array");
        }
        return new Lexicon(readStrings(items, origin));
    }

    private static List<String> readStrings(TomlArray array, String origin) {
        var out = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (!(value instanceof String text)) {
                throw new IllegalArgumentException("Lexicon " + origin + " item " + i + " is not a string: " + value);
            }
            out.add(text);
        }
        return out;
    }
}
