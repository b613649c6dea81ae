package work.lcod.derivation.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.derivation.state.DerivationStep;
import work.lcod.derivation.state.Lexicon;
import work.lcod.derivation.syntax.SyntacticObject;

/**
 * Threads a {@link DerivationStep} through a sequence of operations and keeps every intermediate step.
 * A failed operation leaves the derivation at its last good step.
 */
public final class Derivation {
    private final Lexicon lexicon;
    private final List<DerivationStep> history = new ArrayList<>();
    private final List<Operation> applied = new ArrayList<>();

    private Derivation(Lexicon lexicon, DerivationStep start) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        history.add(Objects.requireNonNull(start, "start"));
    }

    public static Derivation start(Lexicon lexicon) {
        return new Derivation(lexicon, DerivationStep.initial());
    }

    public static Derivation start(Lexicon lexicon, DerivationStep step) {
        return new Derivation(lexicon, step);
    }

    public Derivation apply(Operation operation) {
        Objects.requireNonNull(operation, "operation");
        var next = operation.apply(current(), lexicon);
        applied.add(operation);
        history.add(next);
        return this;
    }

    public Derivation insert(int lexiconIndex) {
        return apply(new Operation.Insert(lexiconIndex));
    }

    public Derivation selectExternal(int n) {
        return apply(new Operation.SelectExternal(n));
    }

    public Derivation selectInternal(int n) {
        return apply(new Operation.SelectInternal(n));
    }

    public Derivation selectSpellout(int n) {
        return apply(new Operation.SelectSpellout(n));
    }

    public Lexicon lexicon() {
        return lexicon;
    }

    public DerivationStep current() {
        return history.get(history.size() - 1);
    }

    public Optional<SyntacticObject> operating() {
        return current().operating();
    }

    public boolean isComplete() {
        return current().isComplete();
    }

    /**
     * Every step so far, starting with the initial one; one entry longer than {@link #operations()}.
     */
    public List<DerivationStep> history() {
        return Collections.unmodifiableList(history);
    }

    public List<Operation> operations() {
        return Collections.unmodifiableList(applied);
    }
}
