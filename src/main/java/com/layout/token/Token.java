package com.layout.token;

/**
 * A lexical token of the source being formatted.
 *
 * @param text  Token text as it appears in the source
 * @param start Start offset (inclusive)
 * @param end   End offset (exclusive); End boundaries are expressed in these offsets
 */
public record Token(String text, int start, int end) {

    public Token {
        if (text == null) {
            throw new IllegalArgumentException("Token text cannot be null");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                    "Invalid token range [" + start + ", " + end + ") for '" + text + "'");
        }
    }

    /**
     * Create a token whose range is derived from its start offset and text length.
     */
    public static Token at(String text, int start) {
        return new Token(text, start, start + text.length());
    }

    @Override
    public String toString() {
        return "'" + text + "'[" + start + ".." + end + ")";
    }
}
