package com.layout.adapter.spring;

import com.layout.config.ConfigLoader;
import com.layout.config.PolicySetConfig;
import com.layout.policy.DefaultPolicyFactory;
import com.layout.policy.Policy;
import com.layout.policy.PolicyFactory;
import com.layout.resolver.DecisionResolver;
import com.layout.resolver.DefaultDecisionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the layout policy engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "layout.policy", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(LayoutPolicyProperties.class)
public class LayoutPolicyAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LayoutPolicyAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PolicySetConfig policySetConfig(LayoutPolicyProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyFactory policyFactory() {
        return new DefaultPolicyFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public Policy basePolicy(PolicySetConfig config, PolicyFactory policyFactory) {
        Policy policy = policyFactory.create(config);
        log.info("Built base policy for {} v{}: {}", config.name(), config.version(), policy);
        return policy;
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionResolver decisionResolver(Policy basePolicy) {
        return new DefaultDecisionResolver(basePolicy);
    }
}
