package work.lcod.derivation.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.derivation.ops.Derivation;
import work.lcod.derivation.render.Bracket;
import work.lcod.derivation.render.TreeView;
import work.lcod.derivation.runtime.DerivationScript;
import work.lcod.derivation.runtime.LexiconLoader;
import work.lcod.derivation.runtime.OperationRegistry;
import work.lcod.derivation.runtime.ScriptException;
import work.lcod.derivation.runtime.ScriptLoader;
import work.lcod.derivation.runtime.ScriptRunner;
import work.lcod.derivation.state.DerivationStep;

/**
 * Public entry point for running derivation scripts from embedding code or the CLI.
 */
public final class DerivationRunner {
    private static final Logger log = LoggerFactory.getLogger(DerivationRunner.class);

    private final OperationRegistry registry;

    public DerivationRunner() {
        this(OperationRegistry.standard());
    }

    public DerivationRunner(OperationRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Runs one script. The configured log level is installed first; slf4j-simple only honours it when no
     * logger has been created yet in this JVM, so the CLI installs it before creating the runner.
     */
    public RunResult run(RunConfiguration configuration) {
        configuration.logLevel().install();
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("script", configuration.script().toString());
        metadata.put("logLevel", configuration.logLevel().name());
        try {
            var script = loadScript(configuration);
            log.info("Running {} ({} steps, lexicon of {})", script.display(), script.steps().size(), script.lexicon().size());
            var derivation = ScriptRunner.run(registry, script);
            describe(metadata, derivation, configuration.includeTrace());
            if (derivation.isComplete()) {
                return RunResult.complete(metadata, started);
            }
            log.info("Derivation {} is incomplete after {} steps", script.display(), derivation.operations().size());
            return RunResult.incomplete(metadata, started, configuration.requireComplete());
        } catch (ScriptException ex) {
            log.warn("Derivation {} failed: {}", configuration.script(), ex.getMessage());
            if (ex.derivation() != null) {
                describe(metadata, ex.derivation(), configuration.includeTrace());
            }
            var error = new LinkedHashMap<String, Object>();
            error.put("step", ex.stepIndex());
            error.put("code", ex.code());
            ex.derivationError().ifPresent(de -> error.putAll(de.toMap()));
            error.put("message", ex.getMessage());
            metadata.put("failure", error);
            return RunResult.failure(ex.getMessage(), metadata, started);
        } catch (RuntimeException ex) {
            if (Boolean.getBoolean("lcod.debug")) {
                log.warn("Unable to run {}", configuration.script(), ex);
            } else {
                log.warn("Unable to run {}: {}", configuration.script(), ex.getMessage());
            }
            var message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return RunResult.failure(message, metadata, started);
        }
    }

    private DerivationScript loadScript(RunConfiguration configuration) {
        var script = ScriptLoader.loadFromLocalFile(configuration.script());
        return configuration.lexiconOverride()
            .map(LexiconLoader::loadFromFile)
            .map(script::withLexicon)
            .orElse(script);
    }

    private static void describe(Map<String, Object> metadata, Derivation derivation, boolean includeTrace) {
        var current = derivation.current();
        metadata.put("complete", current.isComplete());
        metadata.put("steps", derivation.operations().size());
        current.operating().ifPresent(so -> {
            metadata.put("bracket", Bracket.render(so));
            metadata.put("operatingSpace", TreeView.toMap(so));
        });
        metadata.put("resourceSpace", TreeView.brackets(current.resources()));
        if (includeTrace) {
            metadata.put("trace", trace(derivation));
        }
    }

    private static List<Map<String, Object>> trace(Derivation derivation) {
        var operations = derivation.operations();
        var history = derivation.history();
        var entries = new ArrayList<Map<String, Object>>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            var operation = operations.get(i);
            DerivationStep after = history.get(i + 1);
            var entry = new LinkedHashMap<String, Object>();
            entry.put("op", operation.id());
            entry.put("index", operation.index());
            entry.put("resourceSpace", TreeView.brackets(after.resources()));
            entry.put("operatingSpace", after.operating().map(Bracket::render).orElse(null));
            entries.add(entry);
        }
        return entries;
    }
}
