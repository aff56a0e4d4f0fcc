package com.layout.resolver;

import com.layout.core.Decision;
import com.layout.core.Split;

import java.util.List;

/**
 * Default implementation of Resolution.
 */
public class DefaultResolution implements Resolution {

    private final PathPolicy pathPolicy;
    private final List<Split> splits;
    private final boolean overridden;
    private final String explanation;

    private DefaultResolution(PathPolicy pathPolicy, List<Split> splits,
                              boolean overridden, String explanation) {
        this.pathPolicy = pathPolicy;
        this.splits = splits;
        this.overridden = overridden;
        this.explanation = explanation;
    }

    @Override
    public PathPolicy getPathPolicy() {
        return pathPolicy;
    }

    @Override
    public List<Split> getSplits() {
        return splits;
    }

    @Override
    public boolean isOverridden() {
        return overridden;
    }

    @Override
    public boolean isDequeueBlocked() {
        return pathPolicy.isDequeueBlocked();
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "Resolution{" +
                "overridden=" + overridden +
                ", splits=" + splits +
                ", policy=" + pathPolicy.describe() +
                '}';
    }

    /**
     * Create a result for a decision the policy overrode.
     */
    public static Resolution overridden(PathPolicy pathPolicy, Decision decision, List<Split> splits) {
        String explanation = "Overridden " + decision.splits() + " -> " + splits
                + " | Policy: " + pathPolicy.describe();
        return new DefaultResolution(pathPolicy, List.copyOf(splits), true, explanation);
    }

    /**
     * Create a result for a decision no rule applied to.
     */
    public static Resolution passThrough(PathPolicy pathPolicy, Decision decision) {
        String explanation = pathPolicy.isUnconstrained()
                ? "No active policy - default splits kept"
                : "No active rule applies - default splits kept | Policy: " + pathPolicy.describe();
        return new DefaultResolution(pathPolicy, decision.splits(), false, explanation);
    }
}
