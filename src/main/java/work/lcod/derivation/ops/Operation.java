package work.lcod.derivation.ops;

import work.lcod.derivation.state.DerivationStep;
import work.lcod.derivation.state.Lexicon;

/**
 * A single request issued by a derivation driver. Each operation consumes one step and produces the next.
 */
public sealed interface Operation
    permits Operation.Insert, Operation.SelectExternal, Operation.SelectInternal, Operation.SelectSpellout {

    String INSERT = "insert";
    String SELECT_EXTERNAL = "select1";
    String SELECT_INTERNAL = "select2";
    String SELECT_SPELLOUT = "select3";

    String id();

    int index();

    DerivationStep apply(DerivationStep step, Lexicon lexicon);

    record Insert(int index) implements Operation {
        @Override
        public String id() {
            return INSERT;
        }

        @Override
        public DerivationStep apply(DerivationStep step, Lexicon lexicon) {
            return step.withResources(Select.insert(lexicon, index, step.resources()));
        }
    }

    record SelectExternal(int index) implements Operation {
        @Override
        public String id() {
            return SELECT_EXTERNAL;
        }

        @Override
        public DerivationStep apply(DerivationStep step, Lexicon lexicon) {
            return Select.external(index, step);
        }
    }

    record SelectInternal(int index) implements Operation {
        @Override
        public String id() {
            return SELECT_INTERNAL;
        }

        @Override
        public DerivationStep apply(DerivationStep step, Lexicon lexicon) {
            return Select.internal(index, step);
        }
    }

    record SelectSpellout(int index) implements Operation {
        @Override
        public String id() {
            return SELECT_SPELLOUT;
        }

        @Override
        public DerivationStep apply(DerivationStep step, Lexicon lexicon) {
            return Select.spellout(index, step);
        }
    }
}
