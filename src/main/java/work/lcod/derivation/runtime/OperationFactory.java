package work.lcod.derivation.runtime;

import work.lcod.derivation.ops.Operation;

/**
 * Builds a typed operation from the index given in a script step.
 */
@FunctionalInterface
public interface OperationFactory {
    Operation create(int index);
}
