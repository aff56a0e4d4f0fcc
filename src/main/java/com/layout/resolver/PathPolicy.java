package com.layout.resolver;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.policy.Clause;
import com.layout.policy.Combinator;
import com.layout.policy.Policy;
import com.layout.token.FormatToken;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * The effective policy held by one search path.
 * <p>
 * Immutable: every step returns a new holder (or this one when nothing
 * changed), so a path is cloned by sharing the reference.
 */
public final class PathPolicy {

    private static final PathPolicy INITIAL = new PathPolicy(Policy.empty());

    private final Policy policy;

    private PathPolicy(Policy policy) {
        this.policy = policy;
    }

    /**
     * Path without any active constraint.
     */
    public static PathPolicy initial() {
        return INITIAL;
    }

    public static PathPolicy of(Policy policy) {
        Objects.requireNonNull(policy, "policy");
        return policy.isEmpty() ? INITIAL : new PathPolicy(policy);
    }

    public Policy policy() {
        return policy;
    }

    /**
     * Drop rules whose range ends before the boundary.
     * Must be called before resolving a decision at that boundary.
     */
    public PathPolicy advanceTo(FormatToken ft) {
        return wrap(policy.unexpired(ft));
    }

    /**
     * Candidate splits after the held policy's override, or the decision's
     * own splits where the policy does not apply.
     */
    public List<Split> effectiveSplits(Decision decision) {
        return policy.apply(decision);
    }

    /**
     * Whether the held policy overrides this decision at all.
     */
    public boolean overrides(Decision decision) {
        return policy.tryApply(decision).isPresent();
    }

    /**
     * Add a newly attached rule to the held policy.
     */
    public PathPolicy attach(Policy attached, Combinator combinator) {
        return wrap(combinator.combine(policy, attached));
    }

    /**
     * Remove every clause matching the predicate, e.g. all rules created for
     * a branch of the search that is being abandoned.
     */
    public PathPolicy discard(Predicate<Clause> pred) {
        return wrap(policy.filter(pred.negate()));
    }

    /**
     * Keep only clauses matching the predicate.
     */
    public PathPolicy retainOnly(Predicate<Clause> pred) {
        return wrap(policy.filter(pred));
    }

    /**
     * Whether the search state holding this path must stay queued.
     */
    public boolean isDequeueBlocked() {
        return policy.noDequeue();
    }

    public boolean isUnconstrained() {
        return policy.isEmpty();
    }

    /**
     * Human-readable rendering of every active rule.
     */
    public String describe() {
        return policy.toString();
    }

    private PathPolicy wrap(Policy next) {
        return next == policy ? this : of(next);
    }

    @Override
    public String toString() {
        return "PathPolicy{" + policy + '}';
    }
}
