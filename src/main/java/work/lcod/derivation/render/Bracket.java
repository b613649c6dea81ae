package work.lcod.derivation.render;

import java.util.Objects;
import work.lcod.derivation.syntax.Preorder;
import work.lcod.derivation.syntax.SyntacticObject;

/**
 * Labelled-bracket rendering of syntactic objects.
 *
 * <p>A binary node prints its first daughter as a single token followed by the bracketed second
 * daughter, so {@code Binary(John, left)} renders as {@code [ John [ left ] ]}. A complex first
 * daughter (a spelled-out unit or a moved phrase) is flattened into its terminal yield joined by spaces.
 */
public final class Bracket {
    private Bracket() {}

    public static String render(SyntacticObject so) {
        Objects.requireNonNull(so, "so");
        var sb = new StringBuilder();
        append(sb, so);
        return sb.toString();
    }

    public static String token(SyntacticObject so) {
        if (so instanceof SyntacticObject.Terminal terminal) {
            return terminal.text();
        }
        return String.join(" ", Preorder.yieldOf(so));
    }

    private static void append(StringBuilder sb, SyntacticObject so) {
        sb.append("[ ");
        if (so instanceof SyntacticObject.Terminal terminal) {
            sb.append(terminal.text());
        } else if (so instanceof SyntacticObject.Unary unary) {
            append(sb, unary.child());
        } else if (so instanceof SyntacticObject.Binary binary) {
            sb.append(token(binary.left())).append(' ');
            append(sb, binary.right());
        }
        sb.append(" ]");
    }
}
