package com.layout.policy;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.token.FormatToken;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Leaf policy: an override, the boundary it expires at, a block-dequeue
 * flag and a provenance label.
 */
public sealed class Clause extends Policy permits Proxy {

    private final PolicyOverride override;
    private final End.WithPos endPolicy;
    private final boolean noDequeue;
    private final String label;

    Clause(PolicyOverride override, End.WithPos endPolicy, boolean noDequeue, String label) {
        this.override = Objects.requireNonNull(override, "override");
        this.endPolicy = Objects.requireNonNull(endPolicy, "endPolicy");
        this.noDequeue = noDequeue;
        this.label = Objects.requireNonNull(label, "label");
    }

    @Override
    public Optional<List<Split>> tryApply(Decision decision) {
        return override.tryApply(decision);
    }

    @Override
    public Policy unexpired(FormatToken ft) {
        return endPolicy.notExpiredBy(ft) ? this : NoPolicy.INSTANCE;
    }

    @Override
    public Policy filter(Predicate<Clause> pred) {
        return pred.test(this) ? this : NoPolicy.INSTANCE;
    }

    @Override
    public boolean exists(Predicate<Clause> pred) {
        return pred.test(this);
    }

    @Override
    public boolean noDequeue() {
        return noDequeue;
    }

    @Override
    public PolicyType getType() {
        return PolicyType.CLAUSE;
    }

    public End.WithPos endPolicy() {
        return endPolicy;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label + endPolicy + (noDequeue() ? "!d" : "d");
    }
}
