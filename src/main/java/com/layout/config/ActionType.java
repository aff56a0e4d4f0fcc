package com.layout.config;

/**
 * What a configured override does to the candidate splits.
 */
public enum ActionType {
    /** Keep only the named splits. */
    KEEP,

    /** Drop the named splits. */
    REMOVE,

    /** Keep only the first candidate. */
    FIRST
}
