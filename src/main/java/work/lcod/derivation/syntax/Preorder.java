package work.lcod.derivation.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root-first enumeration of a syntactic object's constituents. Index 0 is always the whole object;
 * the listing is rebuilt on every call so it can be used as a positional address.
 */
public final class Preorder {
    private Preorder() {}

    public static List<SyntacticObject> of(SyntacticObject so) {
        Objects.requireNonNull(so, "so");
        var out = new ArrayList<SyntacticObject>();
        collect(so, out);
        return Collections.unmodifiableList(out);
    }

    public static int nodeCount(SyntacticObject so) {
        if (so instanceof SyntacticObject.Unary unary) {
            return 1 + nodeCount(unary.child());
        }
        if (so instanceof SyntacticObject.Binary binary) {
            return 1 + nodeCount(binary.left()) + nodeCount(binary.right());
        }
        return 1;
    }

    /**
     * Returns the constituent at preorder position {@code index}, or empty when the index is not valid.
     */
    public static Optional<SyntacticObject> at(SyntacticObject so, int index) {
        if (index < 0) {
            return Optional.empty();
        }
        var nodes = of(so);
        return index < nodes.size() ? Optional.of(nodes.get(index)) : Optional.empty();
    }

    /**
     * Terminal texts in preorder, i.e. in the left-to-right order the tree shape encodes.
     */
    public static List<String> yieldOf(SyntacticObject so) {
        var words = new ArrayList<String>();
        for (var node : of(so)) {
            if (node instanceof SyntacticObject.Terminal terminal) {
                words.add(terminal.text());
            }
        }
        return words;
    }

    private static void collect(SyntacticObject so, List<SyntacticObject> out) {
        out.add(so);
        if (so instanceof SyntacticObject.Unary unary) {
            collect(unary.child(), out);
        } else if (so instanceof SyntacticObject.Binary binary) {
            collect(binary.left(), out);
            collect(binary.right(), out);
        }
    }
}
