package work.lcod.derivation.runtime;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.derivation.ops.Operation;

/**
 * Maps script operation ids (and their aliases) to operation factories.
 */
public final class OperationRegistry {
    private final Map<String, OperationFactory> factories = new ConcurrentHashMap<>();

    /**
     * Registry with the four derivation operations and their descriptive aliases.
     */
    public static OperationRegistry standard() {
        return new OperationRegistry()
            .register(Operation.INSERT, Operation.Insert::new)
            .register(Operation.SELECT_EXTERNAL, Operation.SelectExternal::new)
            .register(Operation.SELECT_INTERNAL, Operation.SelectInternal::new)
            .register(Operation.SELECT_SPELLOUT, Operation.SelectSpellout::new)
            .alias("external", Operation.SELECT_EXTERNAL)
            .alias("internal", Operation.SELECT_INTERNAL)
            .alias("move", Operation.SELECT_INTERNAL)
            .alias("spellout", Operation.SELECT_SPELLOUT);
    }

    public OperationRegistry register(String id, OperationFactory factory) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Operation id must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Operation factory must not be null: " + id);
        }
        factories.put(normalize(id), factory);
        return this;
    }

    public OperationRegistry alias(String alias, String target) {
        var factory = get(target);
        if (factory == null) {
            throw new IllegalArgumentException("Cannot alias unknown operation: " + target);
        }
        return register(alias, factory);
    }

    public OperationFactory get(String id) {
        return id == null ? null : factories.get(normalize(id));
    }

    public Operation create(String id, int index) {
        var factory = get(id);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown operation: " + id);
        }
        return factory.create(index);
    }

    public Map<String, OperationFactory> entries() {
        return Collections.unmodifiableMap(factories);
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
