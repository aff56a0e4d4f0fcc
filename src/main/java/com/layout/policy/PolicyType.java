package com.layout.policy;

/**
 * Variants of {@link Policy}. The set is closed.
 */
public enum PolicyType {
    // Identity
    NONE,

    // Leaf
    CLAUSE,
    PROXY,

    // Composite
    AND_THEN,
    OR_ELSE
}
