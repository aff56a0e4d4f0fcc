package com.layout.resolver;

import com.layout.core.Decision;
import com.layout.policy.Combinator;
import com.layout.policy.Policy;

/**
 * Applies a search path's policy to the decisions along the path.
 */
public interface DecisionResolver {

    /**
     * Narrow the path's policy to the decision's boundary and apply it.
     *
     * @param pathPolicy Policy held by the search path
     * @param decision   Decision at the next boundary
     * @return Narrowed policy and effective splits
     */
    Resolution resolve(PathPolicy pathPolicy, Decision decision);

    /**
     * Policy every search path starts with.
     */
    PathPolicy initialPath();

    /**
     * Attach a rule to a path's policy.
     */
    default PathPolicy attach(PathPolicy pathPolicy, Policy attached, Combinator combinator) {
        return pathPolicy.attach(attached, combinator);
    }
}
