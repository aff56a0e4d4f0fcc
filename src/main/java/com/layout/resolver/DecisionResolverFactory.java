package com.layout.resolver;

import com.layout.config.PolicySetConfig;
import com.layout.policy.DefaultPolicyFactory;
import com.layout.policy.PolicyFactory;

/**
 * Factory for creating DecisionResolver implementations based on config.
 */
public final class DecisionResolverFactory {

    private DecisionResolverFactory() {
    }

    public static DecisionResolver create(PolicySetConfig config) {
        return create(config, new DefaultPolicyFactory());
    }

    public static DecisionResolver create(PolicySetConfig config, PolicyFactory policyFactory) {
        return new DefaultDecisionResolver(policyFactory.create(config));
    }
}
