package com.layout.policy;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.token.FormatToken;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * First match of two policies: {@code p1} wherever it applies, otherwise {@code p2}.
 */
final class OrElse extends Policy {

    private final Policy p1;
    private final Policy p2;
    private final PolicyOverride override;

    OrElse(Policy p1, Policy p2) {
        this.p1 = p1;
        this.p2 = p2;
        this.override = decision -> {
            Optional<List<Split>> first = p1.tryApply(decision);
            return first.isPresent() ? first : p2.tryApply(decision);
        };
    }

    @Override
    public Optional<List<Split>> tryApply(Decision decision) {
        return override.tryApply(decision);
    }

    @Override
    public Policy unexpired(FormatToken ft) {
        return p1.unexpired(ft).or(p2.unexpired(ft));
    }

    @Override
    public Policy filter(Predicate<Clause> pred) {
        return p1.filter(pred).or(p2.filter(pred));
    }

    @Override
    public boolean exists(Predicate<Clause> pred) {
        return p1.exists(pred) || p2.exists(pred);
    }

    @Override
    public boolean noDequeue() {
        return p1.noDequeue() || p2.noDequeue();
    }

    @Override
    public PolicyType getType() {
        return PolicyType.OR_ELSE;
    }

    @Override
    public String toString() {
        return "(" + p1 + " | " + p2 + ")";
    }
}
