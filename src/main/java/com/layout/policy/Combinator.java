package com.layout.policy;

/**
 * How a newly attached policy joins the policy already held.
 */
public enum Combinator {

    /** Held policy narrows first, the new one narrows the result. */
    AND_THEN,

    /** Held policy wins wherever it applies, the new one elsewhere. */
    OR_ELSE;

    public Policy combine(Policy held, Policy attached) {
        return switch (this) {
            case AND_THEN -> held.and(attached);
            case OR_ELSE -> held.or(attached);
        };
    }
}
