package work.lcod.derivation.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.derivation.api.DerivationRunner;
import work.lcod.derivation.api.LogLevel;
import work.lcod.derivation.api.RunConfiguration;
import work.lcod.derivation.api.RunResult;

@CommandLine.Command(
    name = "lcod-derive",
    description = "Run derivation scripts and print the resulting syntactic objects as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class DeriveCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--script"},
        required = true,
        description = "Derivation script (YAML or JSON).",
        arity = "1..*"
    )
    private List<Path> scripts = new ArrayList<>();

    @CommandLine.Option(
        names = {"-l", "--lexicon"},
        description = "TOML lexicon replacing the one declared by the script.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path lexicon;

    @CommandLine.Option(
        names = "--trace",
        description = "Include every intermediate step in the output."
    )
    private boolean trace;

    @CommandLine.Option(
        names = "--require-complete",
        description = "Exit with code " + RunResult.INCOMPLETE_EXIT_CODE + " when a derivation does not end complete."
    )
    private boolean requireComplete;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        LogLevel logLevel = resolveLogLevel();
        logLevel.install();

        if (lexicon != null && !Files.isRegularFile(lexicon)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Lexicon file not found: " + lexicon);
        }

        var runner = new DerivationRunner();
        var out = spec.commandLine().getOut();
        int exitCode = 0;
        for (Path script : scripts) {
            var configuration = RunConfiguration.builder()
                .script(script)
                .lexiconOverride(lexicon)
                .includeTrace(trace)
                .requireComplete(requireComplete)
                .logLevel(logLevel)
                .build();
            RunResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.exitCode());
            out.println(result.toPrettyJson());
        }
        out.flush();
        return exitCode;
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("LCOD_LOG_LEVEL");
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
