package com.layout.policy;

import com.layout.token.FormatToken;
import com.layout.token.Token;

/**
 * Kinds of expiration boundary for a policy.
 * <p>
 * A boundary is fixed at construction from a token's end offset and is a
 * pure function of the token boundary afterwards.
 */
public enum End {

    /** Active while the left token ends at or before the position. */
    AFTER(">"),

    /** Active while the right token ends strictly before the position. */
    BEFORE("<"),

    /** Active while the right token ends at or before the position. */
    ON("@");

    private final String symbol;

    End(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Boundary at a fixed offset.
     */
    public WithPos at(int endPos) {
        return new WithPos(this, endPos);
    }

    /**
     * Boundary at the end offset of a token.
     */
    public WithPos at(Token token) {
        return at(token.end());
    }

    /**
     * An expiration boundary bound to an offset.
     *
     * @param kind   Boundary kind
     * @param endPos Offset the boundary is measured against
     */
    public record WithPos(End kind, int endPos) {

        public WithPos {
            if (kind == null) {
                throw new IllegalArgumentException("End kind cannot be null");
            }
        }

        /**
         * Check whether a policy with this boundary still covers the token boundary.
         */
        public boolean notExpiredBy(FormatToken ft) {
            return switch (kind) {
                case AFTER -> ft.left().end() <= endPos;
                case BEFORE -> ft.right().end() < endPos;
                case ON -> ft.right().end() <= endPos;
            };
        }

        @Override
        public String toString() {
            return kind.symbol + endPos;
        }
    }
}
