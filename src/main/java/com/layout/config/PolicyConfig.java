package com.layout.config;

import com.layout.policy.PolicyType;

import java.util.List;

/**
 * Configuration for a policy.
 *
 * @param type      Policy variant (CLAUSE, AND_THEN, OR_ELSE, PROXY, NONE)
 * @param label     Provenance label shown in diagnostics
 * @param end       Expiration boundary for CLAUSE and PROXY
 * @param noDequeue Whether the clause keeps its search state queued while active
 * @param override  Override for CLAUSE
 * @param policies  Nested policies for AND_THEN/OR_ELSE (one or more) and PROXY (exactly one)
 */
public record PolicyConfig(
        PolicyType type,
        String label,
        EndConfig end,
        boolean noDequeue,
        OverrideConfig override,
        List<PolicyConfig> policies
) {
    /**
     * Create an empty policy configuration.
     */
    public static PolicyConfig none() {
        return new PolicyConfig(PolicyType.NONE, null, null, false, null, null);
    }

    /**
     * Create a CLAUSE configuration.
     */
    public static PolicyConfig clause(String label, EndConfig end, OverrideConfig override) {
        return new PolicyConfig(PolicyType.CLAUSE, label, end, false, override, null);
    }

    /**
     * Create an AND_THEN configuration.
     */
    public static PolicyConfig andThen(List<PolicyConfig> policies) {
        return new PolicyConfig(PolicyType.AND_THEN, null, null, false, null, policies);
    }

    /**
     * Create an OR_ELSE configuration.
     */
    public static PolicyConfig orElse(List<PolicyConfig> policies) {
        return new PolicyConfig(PolicyType.OR_ELSE, null, null, false, null, policies);
    }

    /**
     * Create a PROXY configuration delegating to a single nested policy.
     */
    public static PolicyConfig proxy(String label, EndConfig end, PolicyConfig policy) {
        return new PolicyConfig(PolicyType.PROXY, label, end, false, null, List.of(policy));
    }
}
