package com.layout.token;

import java.util.Objects;

/**
 * Boundary between two lexically adjacent tokens, the place where a layout
 * decision is made. Immutable; created once per boundary.
 *
 * @param left  Token before the boundary
 * @param right Token after the boundary
 * @param index Position of this boundary in the scan (0-based)
 */
public record FormatToken(Token left, Token right, int index) {

    public FormatToken {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
        return "[" + index + "] " + left.text() + " ~ " + right.text();
    }
}
