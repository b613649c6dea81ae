package work.lcod.derivation.syntax;

import java.util.Objects;

/**
 * Immutable syntactic object: a terminal leaf, a one-daughter node or a two-daughter node.
 * Equality is structural; subtrees are shared by reference between derivation steps.
 */
public sealed interface SyntacticObject permits SyntacticObject.Terminal, SyntacticObject.Unary, SyntacticObject.Binary {

    static Terminal terminal(String text) {
        return new Terminal(text);
    }

    static Unary unary(SyntacticObject child) {
        return new Unary(child);
    }

    static Binary binary(SyntacticObject left, SyntacticObject right) {
        return new Binary(left, right);
    }

    record Terminal(String text) implements SyntacticObject {
        public Terminal {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String toString() {
            return text;
        }
    }

    record Unary(SyntacticObject child) implements SyntacticObject {
        public Unary {
            Objects.requireNonNull(child, "child");
        }

        @Override
        public String toString() {
            return "(" + child + ")";
        }
    }

    record Binary(SyntacticObject left, SyntacticObject right) implements SyntacticObject {
        public Binary {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " " + right + ")";
        }
    }
}
