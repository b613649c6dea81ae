package work.lcod.derivation.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DerivationRunnerTest {
    private static final Path SCRIPTS = Path.of("src", "test", "resources", "scripts").toAbsolutePath();

    private static RunResult run(String script, boolean trace) {
        var config = RunConfiguration.builder()
            .script(SCRIPTS.resolve(script))
            .includeTrace(trace)
            .logLevel(LogLevel.INFO)
            .build();
        return new DerivationRunner().run(config);
    }

    @Test
    void runsExternalMergeScript() {
        var result = run("external-merge.yaml", false);
        assertEquals(RunResult.Status.COMPLETE, result.status());
        assertEquals("[ John [ left ] ]", result.metadata().get("bracket"));
        assertEquals(true, result.metadata().get("complete"));
        assertEquals(List.of(), result.metadata().get("resourceSpace"));
        assertFalse(result.metadata().containsKey("trace"));
    }

    @Test
    void runsMovementScriptWithTrace() {
        var result = run("movement.yaml", true);
        assertEquals(RunResult.Status.COMPLETE, result.status());
        assertEquals("[ who [ John [ likes [ who ] ] ] ]", result.metadata().get("bracket"));
        @SuppressWarnings("unchecked")
        var trace = (List<Map<String, Object>>) result.metadata().get("trace");
        assertEquals(7, trace.size());
        assertEquals("insert", trace.get(0).get("op"));
        assertEquals(List.of("[ John ]"), trace.get(0).get("resourceSpace"));
        assertEquals(null, trace.get(0).get("operatingSpace"));
        assertEquals("select2", trace.get(6).get("op"));
        assertEquals(4, trace.get(6).get("index"));
    }

    @Test
    void runsSpelloutScriptWithTomlLexicon() {
        var result = run("spellout.yaml", false);
        assertEquals(RunResult.Status.COMPLETE, result.status());
        assertEquals("[ who [ the boy [ like [ who ] ] ] ]", result.metadata().get("bracket"));
    }

    @Test
    void reportsIncompleteDerivation() {
        var result = run("incomplete.yaml", false);
        assertEquals(RunResult.Status.INCOMPLETE, result.status());
        assertEquals(0, result.exitCode());
        assertEquals(List.of("[ John ]"), result.metadata().get("resourceSpace"));
        assertEquals("[ left ]", result.metadata().get("bracket"));
    }

    @Test
    void reportsFailureWithErrorCode() {
        var result = run("out-of-range.yaml", false);
        assertEquals(RunResult.Status.FAILURE, result.status());
        @SuppressWarnings("unchecked")
        var failure = (Map<String, Object>) result.metadata().get("failure");
        assertEquals("index_out_of_range", failure.get("code"));
        assertEquals(2, failure.get("step"));
        assertEquals(3, failure.get("requested"));
        assertEquals(1, failure.get("available"));
        assertEquals("[ John ]", result.metadata().get("bracket"));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    @Test
    void reportsUnknownOperation() {
        var result = run("unknown-op.yaml", false);
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertTrue(String.valueOf(result.metadata().get("error")).contains("adjoin"));
    }

    @Test
    void reportsMissingScript() {
        var result = run("does-not-exist.yaml", false);
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.exitCode());
    }

    @Test
    void lexiconOverrideReplacesScriptLexicon() {
        var config = RunConfiguration.builder()
            .script(SCRIPTS.resolve("external-merge.yaml"))
            .lexiconOverride(SCRIPTS.resolve("alternate-lexicon.toml"))
            .build();
        var result = new DerivationRunner().run(config);
        assertEquals("[ Mary [ sleeps ] ]", result.metadata().get("bracket"));
    }

    @Test
    void requireCompleteTurnsIncompleteIntoNonZeroExit() {
        var config = RunConfiguration.builder()
            .script(SCRIPTS.resolve("incomplete.yaml"))
            .requireComplete(true)
            .build();
        var result = new DerivationRunner().run(config);
        assertEquals(RunResult.Status.INCOMPLETE, result.status());
        assertEquals(RunResult.INCOMPLETE_EXIT_CODE, result.exitCode());
        assertEquals(RunResult.INCOMPLETE_EXIT_CODE, result.toSerializableMap().get("exitCode"));

        var complete = new DerivationRunner().run(RunConfiguration.builder()
            .script(SCRIPTS.resolve("external-merge.yaml"))
            .requireComplete(true)
            .build());
        assertEquals(0, complete.exitCode());
    }

    @Test
    void negativeIndexFailureKeepsCounts() {
        var result = run("negative-index.yaml", false);
        assertEquals(RunResult.Status.FAILURE, result.status());
        @SuppressWarnings("unchecked")
        var failure = (Map<String, Object>) result.metadata().get("failure");
        assertEquals(1, failure.get("step"));
        assertEquals("index_out_of_range", failure.get("code"));
        assertEquals(-1, failure.get("requested"));
        assertEquals(1, failure.get("available"));
    }

    @Test
    void installsConfiguredLogLevel() {
        var previous = System.getProperty(LogLevel.SIMPLE_LOGGER_LEVEL_PROPERTY);
        try {
            var result = new DerivationRunner().run(RunConfiguration.builder()
                .script(SCRIPTS.resolve("external-merge.yaml"))
                .logLevel(LogLevel.ERROR)
                .build());
            assertEquals("error", System.getProperty(LogLevel.SIMPLE_LOGGER_LEVEL_PROPERTY));
            assertEquals("ERROR", result.metadata().get("logLevel"));
        } finally {
            if (previous == null) {
                System.clearProperty(LogLevel.SIMPLE_LOGGER_LEVEL_PROPERTY);
            } else {
                System.setProperty(LogLevel.SIMPLE_LOGGER_LEVEL_PROPERTY, previous);
            }
        }
    }

    @Test
    void prettyJsonCarriesStatusAndExitCode() {
        var json = run("incomplete.yaml", false).toPrettyJson();
        assertTrue(json.contains("\"status\" : \"incomplete\""));
        assertTrue(json.contains("\"exitCode\" : 0"));
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals("off", LogLevel.OFF.simpleLoggerName());
    }
}
