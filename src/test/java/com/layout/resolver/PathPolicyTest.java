package com.layout.resolver;

import com.layout.core.Decision;
import com.layout.policy.Combinator;
import com.layout.policy.End;
import com.layout.policy.Policy;
import com.layout.policy.PolicyOverride;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.layout.policy.PolicyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PathPolicy.
 */
class PathPolicyTest {

    private final Policy dropSpace = clause("drop-space", End.AFTER.at(10), drop("space"));
    private final Policy blocker = blocking("block", End.BEFORE.at(20));

    @Test
    @DisplayName("Should start without constraints")
    void shouldStartUnconstrained() {
        PathPolicy path = PathPolicy.initial();
        Decision decision = decision("a", "b", "space", "newline");

        assertTrue(path.isUnconstrained());
        assertFalse(path.isDequeueBlocked());
        assertFalse(path.overrides(decision));
        assertEquals(decision.splits(), path.effectiveSplits(decision));
        assertSame(PathPolicy.initial(), PathPolicy.of(Policy.empty()));
    }

    @Test
    @DisplayName("Should apply attached rules until they expire")
    void shouldApplyUntilExpiry() {
        PathPolicy path = PathPolicy.initial().attach(dropSpace, Combinator.AND_THEN);

        PathPolicy atFive = path.advanceTo(boundary(5, 6));
        assertSame(path, atFive);
        assertEquals(splits("newline"), atFive.effectiveSplits(decision(boundary(5, 6), "space", "newline")));

        PathPolicy atEleven = atFive.advanceTo(boundary(11, 12));
        assertTrue(atEleven.isUnconstrained());
        assertEquals(splits("space", "newline"),
                atEleven.effectiveSplits(decision(boundary(11, 12), "space", "newline")));
    }

    @Test
    @DisplayName("Should block dequeue until the blocking rule expires")
    void shouldBlockDequeueUntilExpiry() {
        PathPolicy path = PathPolicy.of(dropSpace).attach(blocker, Combinator.OR_ELSE);

        assertTrue(path.isDequeueBlocked());
        assertTrue(path.advanceTo(boundary(15, 19)).isDequeueBlocked());
        assertFalse(path.advanceTo(boundary(19, 20)).isDequeueBlocked());
    }

    @Test
    @DisplayName("Should combine newly attached rules with the requested combinator")
    void shouldAttachWithCombinator() {
        Policy keepFirst = clause("first", End.AFTER.at(10), PolicyOverride.always(d -> d.splits().subList(0, 1)));
        Decision decision = decision("a", "b", "space", "newline", "indent");

        assertEquals(splits("newline"),
                PathPolicy.of(dropSpace).attach(keepFirst, Combinator.AND_THEN).effectiveSplits(decision));
        assertEquals(splits("newline", "indent"),
                PathPolicy.of(dropSpace).attach(keepFirst, Combinator.OR_ELSE).effectiveSplits(decision));
    }

    @Test
    @DisplayName("Should discard or retain clauses by predicate")
    void shouldDiscardAndRetain() {
        PathPolicy path = PathPolicy.of(dropSpace.and(blocker));

        assertEquals("drop-space>10d", path.discard(c -> c.label().equals("block")).describe());
        assertEquals("block<20!d", path.retainOnly(c -> c.label().equals("block")).describe());
        assertTrue(path.discard(c -> true).isUnconstrained());
        assertEquals(path.describe(), path.retainOnly(c -> true).describe());
    }
}
