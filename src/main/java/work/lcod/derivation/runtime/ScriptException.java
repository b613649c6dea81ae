package work.lcod.derivation.runtime;

import java.util.Optional;
import work.lcod.derivation.ops.Derivation;
import work.lcod.derivation.ops.DerivationException;

/**
 * Raised when a script step cannot be interpreted or its operation fails. Keeps the partial derivation
 * so callers can still report the last good state.
 */
public final class ScriptException extends RuntimeException {
    private final int stepIndex;
    private final transient Derivation derivation;

    public ScriptException(int stepIndex, String message, Derivation derivation, Throwable cause) {
        super("Step " + stepIndex + ": " + message, cause);
        this.stepIndex = stepIndex;
        this.derivation = derivation;
    }

    public int stepIndex() {
        return stepIndex;
    }

    public Derivation derivation() {
        return derivation;
    }

    public Optional<DerivationException> derivationError() {
        return getCause() instanceof DerivationException de ? Optional.of(de) : Optional.empty();
    }

    public String code() {
        return derivationError().map(DerivationException::code).orElse("invalid_step");
    }
}
