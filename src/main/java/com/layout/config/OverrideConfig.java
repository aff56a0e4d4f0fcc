package com.layout.config;

import java.util.List;

/**
 * Configuration for a declarative override.
 *
 * @param left   Required text of the left token (null matches any)
 * @param right  Required text of the right token (null matches any)
 * @param action What to do with the candidate splits
 * @param splits Split names the action refers to (KEEP/REMOVE)
 */
public record OverrideConfig(
        String left,
        String right,
        ActionType action,
        List<String> splits
) {
    /**
     * Keep only the named splits wherever the right token has the given text.
     */
    public static OverrideConfig keepBeforeRight(String right, List<String> splits) {
        return new OverrideConfig(null, right, ActionType.KEEP, splits);
    }

    /**
     * Drop the named splits at every decision.
     */
    public static OverrideConfig removeEverywhere(List<String> splits) {
        return new OverrideConfig(null, null, ActionType.REMOVE, splits);
    }
}
