package com.layout.core;

/**
 * A candidate layout action at a token boundary.
 * Opaque to policies: they only keep, drop or reorder splits.
 *
 * @param name Identifying name of the action (e.g. "space", "newline")
 * @param cost Penalty the search pays for choosing this split
 */
public record Split(String name, int cost) {

    public Split {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Split name cannot be blank");
        }
    }

    public static Split of(String name) {
        return new Split(name, 0);
    }

    @Override
    public String toString() {
        return cost == 0 ? name : name + "(" + cost + ")";
    }
}
