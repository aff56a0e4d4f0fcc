package com.layout.core;

import com.layout.token.FormatToken;

import java.util.List;
import java.util.Objects;

/**
 * Negotiation unit at one token boundary: the boundary plus its candidate splits.
 * Immutable; overrides produce a replacement via {@link #withSplits(List)}.
 *
 * @param formatToken Boundary this decision is made at
 * @param splits      Candidate splits in preference order
 */
public record Decision(FormatToken formatToken, List<Split> splits) {

    public Decision {
        Objects.requireNonNull(formatToken, "formatToken");
        splits = List.copyOf(splits);
    }

    /**
     * Same boundary, different candidates.
     */
    public Decision withSplits(List<Split> newSplits) {
        return new Decision(formatToken, newSplits);
    }

    public boolean hasSplit(String name) {
        return splits.stream().anyMatch(s -> s.name().equals(name));
    }

    @Override
    public String toString() {
        return "Decision{" + formatToken + " -> " + splits + '}';
    }
}
