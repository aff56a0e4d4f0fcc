package com.layout.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered sequence of token boundaries for one forward scan.
 * <p>
 * Guarantees that end offsets never decrease along the scan, which is what
 * makes policy expiration monotonic.
 */
public final class FormatTokens implements Iterable<FormatToken> {

    private final List<FormatToken> boundaries;

    private FormatTokens(List<FormatToken> boundaries) {
        this.boundaries = Collections.unmodifiableList(boundaries);
    }

    /**
     * Build boundaries for every adjacent pair of tokens.
     *
     * @param tokens Tokens in source order
     * @return Boundaries, one fewer than the number of tokens
     * @throws IllegalArgumentException if token end offsets decrease
     */
    public static FormatTokens of(List<Token> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("Token list cannot be null");
        }
        List<FormatToken> result = new ArrayList<>();
        for (int i = 1; i < tokens.size(); i++) {
            Token left = tokens.get(i - 1);
            Token right = tokens.get(i);
            if (right.end() < left.end()) {
                throw new IllegalArgumentException("Token end offsets must not decrease: "
                        + left + " is followed by " + right);
            }
            result.add(new FormatToken(left, right, i - 1));
        }
        return new FormatTokens(result);
    }

    /**
     * Split source text on whitespace and single-character punctuation.
     * Enough for demos and tests; real lexing belongs to the caller.
     */
    public static FormatTokens tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isLetterOrDigit(c) || c == '_') {
                int start = i;
                while (i < source.length()
                        && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(Token.at(source.substring(start, i), start));
            } else {
                tokens.add(Token.at(String.valueOf(c), i));
                i++;
            }
        }
        return of(tokens);
    }

    public FormatToken get(int index) {
        return boundaries.get(index);
    }

    public int size() {
        return boundaries.size();
    }

    /**
     * First boundary at or after {@code from} whose right token has the given text.
     */
    public Optional<FormatToken> findByRight(String text, int from) {
        return boundaries.stream()
                .skip(Math.max(0, from))
                .filter(ft -> ft.right().text().equals(text))
                .findFirst();
    }

    @Override
    public Iterator<FormatToken> iterator() {
        return boundaries.iterator();
    }
}
