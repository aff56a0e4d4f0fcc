package com.layout.policy;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.token.FormatToken;
import com.layout.token.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable rule that overrides the candidate splits of future decisions
 * until its end boundary is passed.
 * <p>
 * Policies are combined with {@link #and(Policy)} (pipeline: the left rule
 * narrows first, the right rule narrows the result) and {@link #or(Policy)}
 * (first match: the left rule wins wherever it applies). Both return a new
 * value or one of the operands and never modify either.
 * <p>
 * {@link NoPolicy#INSTANCE} is the only empty policy. It is the identity of
 * both combinators and is recognized by reference, see {@link #isEmpty()}.
 */
public abstract sealed class Policy permits NoPolicy, Clause, AndThen, OrElse {

    Policy() {
    }

    /**
     * Apply the override to a decision.
     *
     * @param decision Decision at the current boundary
     * @return Replacement splits, or empty if this policy does not apply to the decision
     */
    public abstract Optional<List<Split>> tryApply(Decision decision);

    /**
     * Drop every rule whose range ends before the given boundary.
     *
     * @return This policy, a narrower one, or {@link NoPolicy#INSTANCE}
     */
    public abstract Policy unexpired(FormatToken ft);

    /**
     * Keep only the clauses accepted by the predicate.
     */
    public abstract Policy filter(Predicate<Clause> pred);

    /**
     * Check whether any clause in this policy satisfies the predicate.
     */
    public abstract boolean exists(Predicate<Clause> pred);

    /**
     * Whether a search state holding this policy must stay queued.
     */
    public abstract boolean noDequeue();

    /**
     * Get the policy variant.
     */
    public abstract PolicyType getType();

    /**
     * Effective splits for a decision: the override result, or the decision's
     * own splits when the override does not apply.
     */
    public final List<Split> apply(Decision decision) {
        return tryApply(decision).orElse(decision.splits());
    }

    /**
     * Sequential composition: this policy narrows first, {@code other} narrows the result.
     */
    public Policy and(Policy other) {
        Objects.requireNonNull(other, "other");
        return other.isEmpty() ? this : new AndThen(this, other);
    }

    /**
     * First-match composition: this policy wins wherever it applies, {@code other} elsewhere.
     */
    public Policy or(Policy other) {
        Objects.requireNonNull(other, "other");
        return other.isEmpty() ? this : new OrElse(this, other);
    }

    public final Policy and(Optional<Policy> other) {
        return other.map(p -> and(p)).orElse(this);
    }

    public final Policy or(Optional<Policy> other) {
        return other.map(p -> or(p)).orElse(this);
    }

    /**
     * Same as {@link #unexpired(FormatToken)}, empty instead of {@link NoPolicy}.
     */
    public final Optional<Policy> unexpiredOpt(FormatToken ft) {
        Policy policy = unexpired(ft);
        return policy.isEmpty() ? Optional.empty() : Optional.of(policy);
    }

    public final boolean isEmpty() {
        return this == NoPolicy.INSTANCE;
    }

    public final boolean nonEmpty() {
        return this != NoPolicy.INSTANCE;
    }

    // Factories

    /**
     * The empty policy.
     */
    public static Policy empty() {
        return NoPolicy.INSTANCE;
    }

    public static Policy of(End.WithPos endPolicy, String label, PolicyOverride override) {
        return of(endPolicy, false, label, override);
    }

    /**
     * Create a clause.
     *
     * @param endPolicy Boundary after which the clause expires
     * @param noDequeue Whether the clause keeps its search state queued while active
     * @param label     Provenance shown in diagnostics
     * @param override  Override applied to decisions within range
     */
    public static Policy of(End.WithPos endPolicy, boolean noDequeue, String label,
                            PolicyOverride override) {
        return new Clause(override, endPolicy, noDequeue, label);
    }

    public static Policy after(Token token, String label, PolicyOverride override) {
        return of(End.AFTER.at(token), false, label, override);
    }

    public static Policy after(Token token, boolean noDequeue, String label, PolicyOverride override) {
        return of(End.AFTER.at(token), noDequeue, label, override);
    }

    public static Policy before(Token token, String label, PolicyOverride override) {
        return of(End.BEFORE.at(token), false, label, override);
    }

    public static Policy before(Token token, boolean noDequeue, String label, PolicyOverride override) {
        return of(End.BEFORE.at(token), noDequeue, label, override);
    }

    public static Policy on(Token token, String label, PolicyOverride override) {
        return of(End.ON.at(token), false, label, override);
    }

    public static Policy on(Token token, boolean noDequeue, String label, PolicyOverride override) {
        return of(End.ON.at(token), noDequeue, label, override);
    }
}
