package com.layout.policy;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.token.FormatToken;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The empty policy: applies nowhere, never expires, and is the identity of
 * both {@code and} and {@code or}.
 * <p>
 * {@link #INSTANCE} is the only instance; emptiness is checked by reference.
 */
public final class NoPolicy extends Policy {

    public static final NoPolicy INSTANCE = new NoPolicy();

    private NoPolicy() {
    }

    @Override
    public Optional<List<Split>> tryApply(Decision decision) {
        return Optional.empty();
    }

    @Override
    public Policy and(Policy other) {
        return Objects.requireNonNull(other, "other");
    }

    @Override
    public Policy or(Policy other) {
        return Objects.requireNonNull(other, "other");
    }

    @Override
    public Policy unexpired(FormatToken ft) {
        return this;
    }

    @Override
    public Policy filter(Predicate<Clause> pred) {
        return this;
    }

    @Override
    public boolean exists(Predicate<Clause> pred) {
        return false;
    }

    @Override
    public boolean noDequeue() {
        return false;
    }

    @Override
    public PolicyType getType() {
        return PolicyType.NONE;
    }

    @Override
    public String toString() {
        return "NoPolicy";
    }
}
