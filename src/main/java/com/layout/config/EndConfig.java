package com.layout.config;

import com.layout.policy.End;

/**
 * Configuration for an expiration boundary.
 *
 * @param kind Boundary kind (AFTER, BEFORE, ON)
 * @param pos  Source offset the boundary is measured against
 */
public record EndConfig(End kind, int pos) {

    public End.WithPos toWithPos() {
        return kind.at(pos);
    }
}
