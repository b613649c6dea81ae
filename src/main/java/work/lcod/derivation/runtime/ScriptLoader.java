package work.lcod.derivation.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.derivation.state.Lexicon;

/**
 * Loads derivation scripts (YAML, or JSON as a YAML subset) into a lexicon plus raw step maps.
 */
public final class ScriptLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ScriptLoader() {}

    public static DerivationScript loadFromLocalFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            var root = YAML_MAPPER.readTree(in);
            return fromTree(root, Optional.of(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read script: " + path, ex);
        }
    }

    public static DerivationScript parse(String text) {
        try {
            return fromTree(YAML_MAPPER.readTree(text), Optional.empty());
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid script: " + ex.getMessage(), ex);
        }
    }

    private static DerivationScript fromTree(JsonNode root, Optional<Path> source) throws IOException {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new DerivationScript(source, Lexicon.empty(), List.of());
        }
        if (!root.isObject()) {
            throw new IOException("Script root must be an object");
        }
        var lexicon = readLexicon(root.get("lexicon"), source);
        var steps = new ArrayList<Map<String, Object>>();
        var stepsNode = root.get("steps");
        if (stepsNode != null && !stepsNode.isNull()) {
            if (!stepsNode.isArray()) {
                throw new IOException("'steps' must be a list");
            }
            for (var stepNode : stepsNode) {
                steps.add(toMap(stepNode));
            }
        }
        return new DerivationScript(source, lexicon, steps);
    }

    private static Lexicon readLexicon(JsonNode node, Optional<Path> source) throws IOException {
        if (node == null || node.isNull()) {
            return Lexicon.empty();
        }
        if (node.isArray()) {
            var items = new ArrayList<String>();
            for (var item : node) {
                if (item.isNull() || !item.isValueNode()) {
                    throw new IOException("Lexicon items must be non-null scalars: " + item);
                }
                items.add(item.asText());
            }
            return new Lexicon(items);
        }
        if (node.isTextual()) {
            var file = Path.of(node.asText());
            if (!file.isAbsolute()) {
                var base = source.map(Path::toAbsolutePath).map(Path::getParent);
                file = base.isPresent() ? base.get().resolve(file) : file.toAbsolutePath();
            }
            return LexiconLoader.loadFromFile(file.normalize());
        }
        throw new IOException("'lexicon' must be a list of items or a TOML file path");
    }

    private static Map<String, Object> toMap(JsonNode node) throws IOException {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IOException("Script step must be an object: " + node);
        }
        var map = new LinkedHashMap<String, Object>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            map.put(entry.getKey(), convertNode(entry.getValue()));
        }
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
