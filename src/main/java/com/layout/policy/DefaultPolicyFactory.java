package com.layout.policy;

import com.layout.config.ActionType;
import com.layout.config.OverrideConfig;
import com.layout.config.PolicyConfig;
import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.exception.ConfigurationException;

import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Default implementation of PolicyFactory.
 */
public class DefaultPolicyFactory implements PolicyFactory {

    @Override
    public Policy create(PolicyConfig config) {
        if (config == null) {
            throw new ConfigurationException("Policy configuration cannot be null");
        }

        PolicyType type = config.type();
        if (type == null) {
            throw new ConfigurationException("Policy type cannot be null");
        }

        return switch (type) {
            case NONE -> Policy.empty();
            case CLAUSE -> createClause(config);
            case PROXY -> createProxy(config);
            case AND_THEN -> createAll(validateNested(config), Combinator.AND_THEN);
            case OR_ELSE -> createAll(validateNested(config), Combinator.OR_ELSE);
        };
    }

    private Policy createClause(PolicyConfig config) {
        validateLabel(config);
        validateEnd(config);
        if (config.override() == null) {
            throw new ConfigurationException("CLAUSE '" + config.label() + "' requires an override");
        }
        return Policy.of(config.end().toWithPos(), config.noDequeue(), config.label(),
                createOverride(config.label(), config.override()));
    }

    private Policy createProxy(PolicyConfig config) {
        validateLabel(config);
        validateEnd(config);
        if (config.override() != null) {
            throw new ConfigurationException("PROXY '" + config.label()
                    + "' delegates to its nested policy and cannot have an override");
        }
        if (config.policies() == null || config.policies().size() != 1) {
            throw new ConfigurationException("PROXY '" + config.label()
                    + "' must have exactly one nested policy");
        }
        Policy inner = create(config.policies().get(0));
        return Proxy.delegating(inner, config.end().toWithPos(), config.label());
    }

    private PolicyOverride createOverride(String label, OverrideConfig config) {
        ActionType action = config.action();
        if (action == null) {
            throw new ConfigurationException("Override of '" + label + "' requires an action");
        }

        Function<Decision, List<Split>> result = switch (action) {
            case KEEP -> keep(validateSplits(label, config));
            case REMOVE -> remove(validateSplits(label, config));
            case FIRST -> DefaultPolicyFactory::first;
        };

        return PolicyOverride.when(guard(config), result);
    }

    private static Function<Decision, List<Split>> keep(Set<String> names) {
        return d -> d.splits().stream().filter(s -> names.contains(s.name())).toList();
    }

    private static Function<Decision, List<Split>> remove(Set<String> names) {
        return d -> d.splits().stream().filter(s -> !names.contains(s.name())).toList();
    }

    private static List<Split> first(Decision d) {
        return d.splits().isEmpty() ? List.of() : List.of(d.splits().get(0));
    }

    private static Predicate<Decision> guard(OverrideConfig config) {
        Predicate<Decision> guard = d -> true;
        if (config.left() != null) {
            guard = guard.and(d -> config.left().equals(d.formatToken().left().text()));
        }
        if (config.right() != null) {
            guard = guard.and(d -> config.right().equals(d.formatToken().right().text()));
        }
        return guard;
    }

    // Validation helpers

    private void validateLabel(PolicyConfig config) {
        if (config.label() == null || config.label().isBlank()) {
            throw new ConfigurationException(config.type() + " policy requires a label");
        }
    }

    private void validateEnd(PolicyConfig config) {
        if (config.end() == null || config.end().kind() == null) {
            throw new ConfigurationException(config.type() + " policy '" + config.label()
                    + "' requires an end boundary");
        }
    }

    private List<PolicyConfig> validateNested(PolicyConfig config) {
        if (config.policies() == null || config.policies().isEmpty()) {
            throw new ConfigurationException(config.type() + " policy requires nested policies");
        }
        return config.policies();
    }

    private Set<String> validateSplits(String label, OverrideConfig config) {
        if (config.splits() == null || config.splits().isEmpty()) {
            throw new ConfigurationException(config.action() + " override of '" + label
                    + "' requires a splits list");
        }
        return Set.copyOf(config.splits());
    }
}
