package com.layout.resolver;

import com.layout.core.Split;

import java.util.List;

/**
 * Result of resolving a decision against a path's policy.
 */
public interface Resolution {

    /**
     * Get the path policy narrowed to the decision's boundary.
     * The search continues the path with this value.
     */
    PathPolicy getPathPolicy();

    /**
     * Get the candidate splits after overrides.
     */
    List<Split> getSplits();

    /**
     * Check if any active rule overrode the decision.
     */
    boolean isOverridden();

    /**
     * Check if the search state must stay queued.
     */
    boolean isDequeueBlocked();

    /**
     * Get human-readable explanation of the outcome.
     */
    String getExplanation();
}
