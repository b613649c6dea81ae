package work.lcod.derivation.ops;

import java.util.Locale;

/**
 * Failure categories reported by derivation operations.
 */
public enum ErrorKind {
    INDEX_OUT_OF_RANGE,
    EMPTY_OPERATING_SPACE,
    INVALID_LEXICON_INDEX,
    CONSTITUENT_NOT_FOUND;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
