package work.lcod.derivation.state;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, read-only list of lexical items addressed by position.
 */
public record Lexicon(List<String> items) {
    public Lexicon {
        Objects.requireNonNull(items, "items");
        items = List.copyOf(items);
    }

    public static Lexicon of(String... items) {
        return new Lexicon(List.of(items));
    }

    public static Lexicon empty() {
        return new Lexicon(List.of());
    }

    public int size() {
        return items.size();
    }

    public boolean contains(int index) {
        return index >= 0 && index < items.size();
    }

    public String get(int index) {
        return items.get(index);
    }
}
