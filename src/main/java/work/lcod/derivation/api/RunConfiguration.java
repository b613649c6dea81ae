package work.lcod.derivation.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for running one derivation script.
 */
public record RunConfiguration(
    Path script,
    Optional<Path> lexiconOverride,
    boolean includeTrace,
    boolean requireComplete,
    LogLevel logLevel
) {
    public RunConfiguration {
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(lexiconOverride, "lexiconOverride");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path script;
        private Optional<Path> lexiconOverride = Optional.empty();
        private boolean includeTrace;
        private boolean requireComplete;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder script(Path script) {
            this.script = script;
            return this;
        }

        public Builder lexiconOverride(Path lexicon) {
            this.lexiconOverride = Optional.ofNullable(lexicon);
            return this;
        }

        public Builder includeTrace(boolean includeTrace) {
            this.includeTrace = includeTrace;
            return this;
        }

        /**
         * Makes an incomplete derivation exit with {@link RunResult#INCOMPLETE_EXIT_CODE}.
         */
        public Builder requireComplete(boolean requireComplete) {
            this.requireComplete = requireComplete;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(script, lexiconOverride, includeTrace, requireComplete, logLevel);
        }
    }
}
