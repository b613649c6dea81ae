package work.lcod.derivation.state;

import java.util.Objects;
import java.util.Optional;
import work.lcod.derivation.syntax.SyntacticObject;

/**
 * Snapshot of a derivation: the resource space and the (possibly empty) operating space.
 */
public record DerivationStep(ResourceSpace resources, Optional<SyntacticObject> operating) {
    public DerivationStep {
        Objects.requireNonNull(resources, "resources");
        Objects.requireNonNull(operating, "operating");
    }

    public static DerivationStep initial() {
        return new DerivationStep(ResourceSpace.empty(), Optional.empty());
    }

    public static DerivationStep initial(ResourceSpace resources) {
        return new DerivationStep(resources, Optional.empty());
    }

    public DerivationStep withResources(ResourceSpace next) {
        return new DerivationStep(next, operating);
    }

    public DerivationStep withOperating(Optional<SyntacticObject> next) {
        return new DerivationStep(resources, next);
    }

    /**
     * A derivation is complete once every resource has been consumed into a single operating object.
     */
    public boolean isComplete() {
        return resources.isEmpty() && operating.isPresent();
    }
}
