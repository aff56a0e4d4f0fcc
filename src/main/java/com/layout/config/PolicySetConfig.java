package com.layout.config;

import com.layout.policy.Combinator;

import java.util.List;

/**
 * Root configuration: the policies every search path starts with.
 *
 * @param name       Policy set name
 * @param version    Configuration version
 * @param combinator How the root policies are combined, in declaration order
 * @param policies   Root policies
 */
public record PolicySetConfig(
        String name,
        String version,
        Combinator combinator,
        List<PolicyConfig> policies
) {
    /**
     * Create an empty configuration for testing.
     */
    public static PolicySetConfig empty() {
        return new PolicySetConfig("empty", "1.0", Combinator.AND_THEN, List.of());
    }
}
