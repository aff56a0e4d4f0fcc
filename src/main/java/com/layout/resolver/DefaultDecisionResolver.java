package com.layout.resolver;

import com.layout.core.Decision;
import com.layout.core.Split;
import com.layout.policy.Combinator;
import com.layout.policy.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Default implementation of DecisionResolver.
 * Narrows the held policy to the decision's boundary before applying it.
 */
public class DefaultDecisionResolver implements DecisionResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultDecisionResolver.class);

    private final PathPolicy initialPath;

    public DefaultDecisionResolver() {
        this(Policy.empty());
    }

    public DefaultDecisionResolver(Policy basePolicy) {
        this.initialPath = PathPolicy.of(basePolicy);
        log.info("DecisionResolver initialized with base policy: {}", basePolicy);
    }

    @Override
    public Resolution resolve(PathPolicy pathPolicy, Decision decision) {
        PathPolicy narrowed = pathPolicy.advanceTo(decision.formatToken());
        if (narrowed != pathPolicy) {
            log.trace("Policy narrowed at {}: {} -> {}",
                    decision.formatToken(), pathPolicy.describe(), narrowed.describe());
        }

        Optional<List<Split>> overridden = narrowed.policy().tryApply(decision);
        Resolution result = overridden.isPresent()
                ? DefaultResolution.overridden(narrowed, decision, overridden.get())
                : DefaultResolution.passThrough(narrowed, decision);

        log.debug("Resolved {}: {}", decision.formatToken(), result.getExplanation());
        return result;
    }

    @Override
    public PathPolicy initialPath() {
        return initialPath;
    }

    @Override
    public PathPolicy attach(PathPolicy pathPolicy, Policy attached, Combinator combinator) {
        PathPolicy result = pathPolicy.attach(attached, combinator);
        log.debug("Attached {} with {}: {}", attached, combinator, result.describe());
        return result;
    }
}
