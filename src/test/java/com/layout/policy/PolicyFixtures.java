package com.layout.policy;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.token.FormatToken;
import com.layout.token.Token;

import java.util.Arrays;
import java.util.List;

/**
 * Shared builders for policy tests.
 */
public final class PolicyFixtures {

    private PolicyFixtures() {
    }

    /**
     * Boundary whose left token ends at {@code leftEnd} and right token at {@code rightEnd}.
     */
    public static FormatToken boundary(int leftEnd, int rightEnd) {
        return new FormatToken(new Token("l", 0, leftEnd), new Token("r", leftEnd, rightEnd), 0);
    }

    /**
     * Boundary between two named tokens, each one character wide.
     */
    public static FormatToken boundary(String left, String right, int leftEnd) {
        return new FormatToken(
                new Token(left, leftEnd - 1, leftEnd),
                new Token(right, leftEnd, leftEnd + 1),
                0);
    }

    public static List<Split> splits(String... names) {
        return Arrays.stream(names).map(Split::of).toList();
    }

    public static Decision decision(FormatToken ft, String... splitNames) {
        return new Decision(ft, splits(splitNames));
    }

    public static Decision decision(String left, String right, String... splitNames) {
        return decision(boundary(left, right, 5), splitNames);
    }

    /**
     * Override that keeps only the named split, at every decision.
     */
    public static PolicyOverride force(String name) {
        return PolicyOverride.always(d -> d.splits().stream()
                .filter(s -> s.name().equals(name))
                .toList());
    }

    /**
     * Override that drops the named split, at every decision.
     */
    public static PolicyOverride drop(String name) {
        return PolicyOverride.always(d -> d.splits().stream()
                .filter(s -> !s.name().equals(name))
                .toList());
    }

    /**
     * Override that keeps only the first split, wherever the right token has the given text.
     */
    public static PolicyOverride firstBefore(String right) {
        return PolicyOverride.when(
                d -> d.formatToken().right().text().equals(right),
                d -> d.splits().subList(0, Math.min(1, d.splits().size())));
    }

    public static Policy clause(String label, End.WithPos end, PolicyOverride override) {
        return Policy.of(end, label, override);
    }

    public static Policy blocking(String label, End.WithPos end) {
        return Policy.of(end, true, label, PolicyOverride.none());
    }
}
