package com.layout.policy;

import com.layout.core.Decision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static com.layout.policy.PolicyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Proxy.
 */
class ProxyTest {

    private final Policy innerShort = clause("short", End.AFTER.at(10), drop("space"));
    private final Policy innerLong = clause("long", End.AFTER.at(30), firstBefore(")"));

    @Test
    @DisplayName("Should not build a proxy over the empty policy")
    void shouldShortCircuitOnEmptyInner() {
        assertSame(NoPolicy.INSTANCE, Proxy.of(Policy.empty(), End.AFTER.at(50), "p", p -> p::tryApply));
        assertSame(NoPolicy.INSTANCE, Proxy.delegating(Policy.empty(), End.AFTER.at(50), "p"));
    }

    @Test
    @DisplayName("Should derive its override from the wrapped policy")
    void shouldDeriveOverride() {
        Policy proxy = Proxy.delegating(innerShort.or(innerLong), End.AFTER.at(50), "proxy");
        Decision decision = decision("x", ")", "space", "newline");

        assertEquals(PolicyType.PROXY, proxy.getType());
        assertEquals(innerShort.or(innerLong).tryApply(decision), proxy.tryApply(decision));
        assertEquals(Optional.of(splits("newline")), proxy.tryApply(decision));
    }

    @Test
    @DisplayName("Should rebuild its override from the narrowed wrapped policy")
    void shouldRederiveAfterNarrowing() {
        List<Policy> seen = new ArrayList<>();
        Function<Policy, PolicyOverride> factory = p -> {
            seen.add(p);
            return p::tryApply;
        };
        Policy proxy = Proxy.of(innerShort.or(innerLong), End.AFTER.at(50), "proxy", factory);
        Decision decision = decision("x", ")", "space", "newline");
        assertEquals(Optional.of(splits("newline")), proxy.tryApply(decision));

        Policy narrowed = proxy.unexpired(boundary(11, 12));

        assertEquals(2, seen.size());
        assertSame(innerLong, seen.get(1));
        assertEquals(Optional.of(splits("space")), narrowed.tryApply(decision));
        assertEquals("proxy*(long>30d)>50", narrowed.toString());
    }

    @Test
    @DisplayName("Should expire when the wrapped policy expires")
    void shouldExpireWithInner() {
        Policy proxy = Proxy.delegating(innerShort, End.AFTER.at(50), "proxy");

        Policy rebuilt = Proxy.delegating(innerShort.unexpired(boundary(11, 12)), End.AFTER.at(50), "proxy");

        assertSame(NoPolicy.INSTANCE, rebuilt);
        assertSame(NoPolicy.INSTANCE, proxy.unexpired(boundary(11, 12)));
    }

    @Test
    @DisplayName("Should expire at its own end boundary even if the wrapped policy is alive")
    void shouldExpireAtOwnEnd() {
        Policy proxy = Proxy.delegating(innerLong, End.BEFORE.at(15), "proxy");

        assertTrue(proxy.unexpired(boundary(13, 14)).nonEmpty());
        assertSame(NoPolicy.INSTANCE, proxy.unexpired(boundary(14, 15)));
    }

    @Test
    @DisplayName("Should filter itself first, then the wrapped policy")
    void shouldFilter() {
        Policy proxy = Proxy.delegating(innerShort.and(innerLong), End.AFTER.at(50), "proxy");

        assertSame(NoPolicy.INSTANCE, proxy.filter(cl -> !cl.label().equals("proxy")));
        assertEquals("proxy*(long>30d)>50", proxy.filter(cl -> !cl.label().equals("short")).toString());
        assertSame(NoPolicy.INSTANCE, proxy.filter(cl -> cl.label().equals("proxy")));
    }

    @Test
    @DisplayName("Should search itself and the wrapped policy")
    void shouldSearchInner() {
        Policy proxy = Proxy.delegating(innerShort.and(innerLong), End.AFTER.at(50), "proxy");

        assertTrue(proxy.exists(cl -> cl instanceof Proxy));
        assertTrue(proxy.exists(cl -> cl.label().equals("long")));
        assertFalse(proxy.exists(cl -> cl.label().equals("other")));
    }

    @Test
    @DisplayName("Should take the dequeue flag from the wrapped policy")
    void shouldDelegateNoDequeue() {
        Policy blocker = blocking("block", End.AFTER.at(20));

        assertFalse(Proxy.delegating(innerShort, End.AFTER.at(50), "p").noDequeue());
        assertTrue(Proxy.delegating(innerShort.and(blocker), End.AFTER.at(50), "p").noDequeue());
        assertEquals("p*((short>10d & block>20!d))>50",
                Proxy.delegating(innerShort.and(blocker), End.AFTER.at(50), "p").toString());
    }

    @Test
    @DisplayName("Should compose like any other clause")
    void shouldCompose() {
        Policy proxy = Proxy.delegating(innerLong, End.AFTER.at(50), "proxy");
        Policy composite = proxy.and(innerShort);

        assertEquals("(proxy*(long>30d)>50 & short>10d)", composite.toString());
        assertSame(proxy.getClass(), composite.unexpired(boundary(11, 12)).getClass());
        assertEquals(PolicyType.PROXY, composite.unexpired(boundary(11, 12)).getType());
    }

    @Test
    @DisplayName("Should expose the wrapped policy")
    void shouldExposeWrappedPolicy() {
        Proxy proxy = (Proxy) Proxy.delegating(innerLong, End.AFTER.at(50), "proxy");

        assertSame(innerLong, proxy.policy());
        assertEquals("proxy", proxy.label());
        assertEquals(End.AFTER.at(50), proxy.endPolicy());
    }
}
