package com.layout.policy;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.token.FormatToken;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Pipeline of two policies: {@code p1} narrows the decision first, then
 * {@code p2} narrows what is left. Either step passes the decision through
 * unchanged when its policy does not apply, so the composite applies to every decision.
 */
final class AndThen extends Policy {

    private final Policy p1;
    private final Policy p2;
    private final PolicyOverride override;

    AndThen(Policy p1, Policy p2) {
        this.p1 = p1;
        this.p2 = p2;
        this.override = decision -> {
            Decision narrowed = p1.tryApply(decision).map(decision::withSplits).orElse(decision);
            return Optional.of(p2.tryApply(narrowed).orElse(narrowed.splits()));
        };
    }

    @Override
    public Optional<List<Split>> tryApply(Decision decision) {
        return override.tryApply(decision);
    }

    @Override
    public Policy unexpired(FormatToken ft) {
        return p1.unexpired(ft).and(p2.unexpired(ft));
    }

    @Override
    public Policy filter(Predicate<Clause> pred) {
        return p1.filter(pred).and(p2.filter(pred));
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
        return PolicyType.AND_THEN;
    }

    @Override
    public String toString() {
        return "(" + p1 + " & " + p2 + ")";
    }
}
