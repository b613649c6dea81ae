package work.lcod.derivation.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import work.lcod.derivation.syntax.SyntacticObject;

/**
 * Immutable pool of syntactic objects awaiting selection. Position matters for addressing only.
 * Elements are shared with the previous space, never copied.
 */
public final class ResourceSpace implements Iterable<SyntacticObject> {
    private static final ResourceSpace EMPTY = new ResourceSpace(List.of());

    private final List<SyntacticObject> items;

    private ResourceSpace(List<SyntacticObject> items) {
        this.items = items;
    }

    public static ResourceSpace empty() {
        return EMPTY;
    }

    public static ResourceSpace of(SyntacticObject... items) {
        return of(List.of(items));
    }

    public static ResourceSpace of(List<? extends SyntacticObject> items) {
        Objects.requireNonNull(items, "items");
        return items.isEmpty() ? EMPTY : new ResourceSpace(List.copyOf(items));
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean contains(int index) {
        return index >= 0 && index < items.size();
    }

    public SyntacticObject get(int index) {
        return items.get(index);
    }

    public ResourceSpace prepend(SyntacticObject so) {
        Objects.requireNonNull(so, "so");
        var next = new ArrayList<SyntacticObject>(items.size() + 1);
        next.add(so);
        next.addAll(items);
        return new ResourceSpace(Collections.unmodifiableList(next));
    }

    /**
     * Returns a space without the element at {@code index}; the others keep their relative order.
     */
    public ResourceSpace removeAt(int index) {
        Objects.checkIndex(index, items.size());
        var next = new ArrayList<>(items);
        next.remove(index);
        return next.isEmpty() ? EMPTY : new ResourceSpace(Collections.unmodifiableList(next));
    }

    public List<SyntacticObject> asList() {
        return items;
    }

    @Override
    public Iterator<SyntacticObject> iterator() {
        return items.iterator();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ResourceSpace space && items.equals(space.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
