package com.layout.policy;

import com.layout.config.PolicyConfig;
import com.layout.config.PolicySetConfig;

import java.util.List;

/**
 * Factory that builds policies from configuration.
 */
public interface PolicyFactory {

    /**
     * Create a Policy from configuration.
     *
     * @param config Policy configuration
     * @return Policy instance, {@link NoPolicy#INSTANCE} for NONE
     */
    Policy create(PolicyConfig config);

    /**
     * Create and combine a list of policies in declaration order.
     */
    default Policy createAll(List<PolicyConfig> configs, Combinator combinator) {
        Policy result = Policy.empty();
        if (configs == null) {
            return result;
        }
        for (PolicyConfig config : configs) {
            result = combinator.combine(result, create(config));
        }
        return result;
    }

    /**
     * Create the base policy of a policy set.
     */
    default Policy create(PolicySetConfig config) {
        return createAll(config.policies(), config.combinator());
    }
}
