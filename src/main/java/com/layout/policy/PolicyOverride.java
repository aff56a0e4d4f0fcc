package com.layout.policy;

import com.layout.core.Decision;
import com.layout.core.Split;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Partial override of a decision's candidate splits.
 * <p>
 * An empty result means the decision is outside this override's domain; the
 * caller must then keep the decision's own splits.
 */
@FunctionalInterface
public interface PolicyOverride {

    /**
     * Compute replacement splits for the decision, if this override recognizes it.
     *
     * @param decision Decision at the current boundary
     * @return Replacement splits, or empty if the override does not apply
     */
    Optional<List<Split>> tryApply(Decision decision);

    /**
     * Override that is never defined.
     */
    static PolicyOverride none() {
        return decision -> Optional.empty();
    }

    /**
     * Override defined for every decision matching {@code guard}.
     *
     * @param guard  Domain of the override
     * @param result Replacement splits for a matching decision
     */
    static PolicyOverride when(Predicate<Decision> guard, Function<Decision, List<Split>> result) {
        return decision -> guard.test(decision)
                ? Optional.of(result.apply(decision))
                : Optional.empty();
    }

    /**
     * Override defined for every decision.
     */
    static PolicyOverride always(Function<Decision, List<Split>> result) {
        return decision -> Optional.of(result.apply(decision));
    }
}
