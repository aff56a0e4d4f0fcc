package com.layout.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the layout policy engine.
 */
@ConfigurationProperties(prefix = "layout.policy")
public class LayoutPolicyProperties {

    /**
     * Whether the policy engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the policy set configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:layout-policies.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
