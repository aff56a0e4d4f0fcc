package com.layout.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.layout.policy.PolicyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NoPolicy.
 */
class NoPolicyTest {

    private final Policy empty = Policy.empty();

    @Test
    @DisplayName("Should be the single canonical instance")
    void shouldBeCanonical() {
        assertSame(NoPolicy.INSTANCE, empty);
        assertTrue(empty.isEmpty());
        assertFalse(empty.nonEmpty());
        assertEquals(PolicyType.NONE, empty.getType());
    }

    @Test
    @DisplayName("Should be a fixed point of narrowing")
    void shouldBeFixedPoint() {
        assertSame(empty, empty.unexpired(boundary(1000, 1001)));
        assertSame(empty, empty.filter(c -> true));
        assertSame(empty, empty.filter(c -> false));
        assertTrue(empty.unexpiredOpt(boundary(1, 2)).isEmpty());
    }

    @Test
    @DisplayName("Should match nothing and never block dequeue")
    void shouldMatchNothing() {
        assertFalse(empty.exists(c -> true));
        assertFalse(empty.noDequeue());
        assertTrue(empty.tryApply(decision("a", "b", "space")).isEmpty());
        assertEquals(splits("space"), empty.apply(decision("a", "b", "space")));
    }

    @Test
    @DisplayName("Should return the other operand from both combinators")
    void shouldReturnOtherOperand() {
        Policy p = clause("p", End.ON.at(3), force("space"));

        assertSame(p, empty.and(p));
        assertSame(p, empty.or(p));
        assertSame(empty, empty.and(empty));
        assertSame(empty, empty.or(empty));
    }

    @Test
    @DisplayName("Should render as NoPolicy")
    void shouldRender() {
        assertEquals("NoPolicy", empty.toString());
    }
}
