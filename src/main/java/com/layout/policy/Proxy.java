package com.layout.policy;

import com.layout.token.FormatToken;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Clause whose override is derived from another policy.
 * <p>
 * The override is {@code factory(policy)}, computed at construction. Every
 * narrowing of the wrapped policy builds a new proxy so the override always
 * reflects the current wrapped policy. A proxy is never built over an empty
 * policy: {@link #of} returns {@link NoPolicy#INSTANCE} instead.
 */
public final class Proxy extends Clause {

    private final Policy policy;
    private final Function<Policy, PolicyOverride> factory;

    private Proxy(Policy policy, Function<Policy, PolicyOverride> factory,
                  End.WithPos endPolicy, String label) {
        super(factory.apply(policy), endPolicy, false, label);
        this.policy = policy;
        this.factory = factory;
    }

    /**
     * Create a proxy over {@code policy}.
     *
     * @param policy    Wrapped policy
     * @param endPolicy Boundary after which the proxy itself expires
     * @param label     Provenance shown in diagnostics
     * @param factory   Builds the proxy's override from the current wrapped policy
     * @return The proxy, or {@link NoPolicy#INSTANCE} if {@code policy} is empty
     */
    public static Policy of(Policy policy, End.WithPos endPolicy, String label,
                            Function<Policy, PolicyOverride> factory) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(factory, "factory");
        if (policy.isEmpty()) {
            return NoPolicy.INSTANCE;
        }
        return new Proxy(policy, factory, endPolicy, label);
    }

    /**
     * Proxy that simply forwards to whatever the wrapped policy currently is.
     */
    public static Policy delegating(Policy policy, End.WithPos endPolicy, String label) {
        return of(policy, endPolicy, label, p -> p::tryApply);
    }

    public Policy policy() {
        return policy;
    }

    @Override
    public boolean exists(Predicate<Clause> pred) {
        return pred.test(this) || policy.exists(pred);
    }

    @Override
    public Policy filter(Predicate<Clause> pred) {
        if (!pred.test(this)) {
            return NoPolicy.INSTANCE;
        }
        return of(policy.filter(pred), endPolicy(), label(), factory);
    }

    @Override
    public Policy unexpired(FormatToken ft) {
        if (!endPolicy().notExpiredBy(ft)) {
            return NoPolicy.INSTANCE;
        }
        return of(policy.unexpired(ft), endPolicy(), label(), factory);
    }

    @Override
    public boolean noDequeue() {
        return policy.noDequeue();
    }

    @Override
    public PolicyType getType() {
        return PolicyType.PROXY;
    }

    @Override
    public String toString() {
        return label() + "*(" + policy + ")" + endPolicy();
    }
}
