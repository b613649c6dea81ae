package work.lcod.derivation.ops;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Typed failure of a derivation operation. The step it was applied to is left untouched.
 */
public final class DerivationException extends RuntimeException {
    private final ErrorKind kind;
    private final OptionalInt requested;
    private final OptionalInt available;

    private DerivationException(ErrorKind kind, String message, OptionalInt requested, OptionalInt available) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.requested = requested;
        this.available = available;
    }

    public static DerivationException indexOutOfRange(int requested, int available) {
        return new DerivationException(
            ErrorKind.INDEX_OUT_OF_RANGE,
            "Index " + requested + " is out of range (available: " + available + ")",
            OptionalInt.of(requested),
            OptionalInt.of(available)
        );
    }

    public static DerivationException emptyOperatingSpace() {
        return new DerivationException(
            ErrorKind.EMPTY_OPERATING_SPACE,
            "Operating space is empty",
            OptionalInt.empty(),
            OptionalInt.empty()
        );
    }

    public static DerivationException invalidLexiconIndex(int requested, int available) {
        return new DerivationException(
            ErrorKind.INVALID_LEXICON_INDEX,
            "Lexicon index " + requested + " is out of range (lexicon size: " + available + ")",
            OptionalInt.of(requested),
            OptionalInt.of(available)
        );
    }

    public static DerivationException constituentNotFound(Object constituent) {
        return new DerivationException(
            ErrorKind.CONSTITUENT_NOT_FOUND,
            "Constituent " + constituent + " is neither the operating object nor one of its daughters",
            OptionalInt.empty(),
            OptionalInt.empty()
        );
    }

    public ErrorKind kind() {
        return kind;
    }

    public String code() {
        return kind.code();
    }

    /**
     * The requested position, present only for index failures.
     */
    public OptionalInt requested() {
        return requested;
    }

    public OptionalInt available() {
        return available;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code());
        map.put("message", getMessage());
        requested.ifPresent(value -> map.put("requested", value));
        available.ifPresent(value -> map.put("available", value));
        return map;
    }
}
