package work.lcod.derivation.runtime;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.derivation.ops.Derivation;
import work.lcod.derivation.ops.DerivationException;
import work.lcod.derivation.ops.Operation;
import work.lcod.derivation.render.Bracket;
import work.lcod.derivation.state.DerivationStep;
import work.lcod.derivation.state.Lexicon;

/**
 * Interprets script steps sequentially, threading one derivation step through the resolved operations.
 */
public final class ScriptRunner {
    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);
    private static final String OP_KEY = "op";
    private static final String INDEX_KEY = "index";

    private ScriptRunner() {}

    public static Derivation run(OperationRegistry registry, DerivationScript script) {
        return runSteps(registry, script.lexicon(), script.steps(), DerivationStep.initial());
    }

    public static Derivation runSteps(
        OperationRegistry registry,
        Lexicon lexicon,
        List<Map<String, Object>> rawSteps,
        DerivationStep initial
    ) {
        Objects.requireNonNull(registry, "registry");
        var steps = rawSteps == null ? List.<Map<String, Object>>of() : rawSteps;
        var derivation = Derivation.start(lexicon, initial == null ? DerivationStep.initial() : initial);

        for (int index = 0; index < steps.size(); index++) {
            var step = steps.get(index);
            if (step == null) continue;
            Operation operation;
            try {
                operation = resolve(registry, step);
            } catch (IllegalArgumentException ex) {
                throw new ScriptException(index, ex.getMessage(), derivation, ex);
            }
            try {
                derivation.apply(operation);
            } catch (DerivationException ex) {
                log.debug("Step {} ({} {}) failed: {}", index, operation.id(), operation.index(), ex.getMessage());
                throw new ScriptException(index, operation.id() + " " + operation.index() + " failed: " + ex.getMessage(), derivation, ex);
            }
            if (log.isDebugEnabled()) {
                var current = derivation.current();
                log.debug(
                    "Step {} ({} {}): resources={} operating={}",
                    index,
                    operation.id(),
                    operation.index(),
                    current.resources().size(),
                    current.operating().map(Bracket::render).orElse("-")
                );
            }
        }
        return derivation;
    }

    /**
     * Accepts {@code {select1: 0}} as well as {@code {op: select1, index: 0}}.
     */
    static Operation resolve(OperationRegistry registry, Map<String, Object> step) {
        if (step.containsKey(OP_KEY)) {
            var id = Objects.toString(step.get(OP_KEY), null);
            if (!step.containsKey(INDEX_KEY)) {
                throw new IllegalArgumentException("Missing '" + INDEX_KEY + "' for operation " + id);
            }
            return registry.create(id, toIndex(id, step.get(INDEX_KEY)));
        }
        if (step.size() != 1) {
            throw new IllegalArgumentException("Step must have a single operation key or an 'op' key: " + step);
        }
        var entry = step.entrySet().iterator().next();
        return registry.create(entry.getKey(), toIndex(entry.getKey(), entry.getValue()));
    }

    private static int toIndex(String id, Object raw) {
        if (raw instanceof Integer value) {
            return value;
        }
        if (raw instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException ex) {
                throw new IllegalArgumentException("Index for " + id + " must be an integer: " + raw);
            }
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Index for " + id + " must be an integer: " + raw);
            }
        }
        throw new IllegalArgumentException("Index for " + id + " must be an integer: " + raw);
    }
}
