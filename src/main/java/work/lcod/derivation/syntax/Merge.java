package work.lcod.derivation.syntax;

import java.util.Objects;
import java.util.Optional;

/**
 * The single structure-building primitive shared by every select operation.
 */
public final class Merge {
    private Merge() {}

    /**
     * Merges {@code xp} with an optional second operand. Without one, {@code xp} is returned as is;
     * otherwise a new {@link SyntacticObject.Binary} is built with {@code xp} as first daughter.
     */
    public static SyntacticObject merge(SyntacticObject xp, Optional<SyntacticObject> yp) {
        Objects.requireNonNull(xp, "xp");
        Objects.requireNonNull(yp, "yp");
        return yp.<SyntacticObject>map(other -> new SyntacticObject.Binary(xp, other)).orElse(xp);
    }
}
