package org.lpreader.frontend.sections;

import org.lpreader.frontend.token.Token;
import org.lpreader.frontend.token.TokenType;

import java.util.List;

/**
 * An immutable view of the half-open range {@code [start, end)} of a read-only token list.
 * <p>
 * Consuming tokens never mutates a slice; {@link #advance(int)} returns the remainder as
 * a new slice, so section handlers can be written as functions from a slice to a parsed
 * entity plus the remaining slice.
 *
 * @param tokens The shared, unmodifiable token list.
 * @param start The index of the first token of the slice.
 * @param end The index after the last token of the slice.
 */
public record TokenSlice(List<Token> tokens, int start, int end) {

    public TokenSlice {
        if (start < 0 || start > end || end > tokens.size()) {
            throw new IllegalArgumentException("Invalid slice [" + start + ", " + end + ") of " + tokens.size() + " tokens");
        }
    }

    /**
     * Creates a slice over a whole list.
     * @param tokens The tokens; the list must not be modified afterwards.
     * @return The slice.
     */
    public static TokenSlice of(List<Token> tokens) {
        return new TokenSlice(tokens, 0, tokens.size());
    }

    public boolean isEmpty() {
        return start == end;
    }

    public int size() {
        return end - start;
    }

    /**
     * Returns a token relative to the start of the slice.
     * @param offset The distance from the first token.
     * @return The token, or {@code null} if the slice is shorter than {@code offset + 1}.
     */
    public Token peek(int offset) {
        int index = start + offset;
        return index < end ? tokens.get(index) : null;
    }

    /**
     * @return The first token, or {@code null} if the slice is empty.
     */
    public Token first() {
        return peek(0);
    }

    /**
     * Checks the types of the leading tokens.
     * @param types The expected types, starting at the first token.
     * @return true if the slice has at least {@code types.length} tokens and each matches.
     */
    public boolean startsWith(TokenType... types) {
        if (size() < types.length) {
            return false;
        }
        for (int i = 0; i < types.length; i++) {
            if (tokens.get(start + i).type() != types[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param count The number of tokens to drop, at most {@link #size()}.
     * @return The slice without its first {@code count} tokens.
     */
    public TokenSlice advance(int count) {
        return new TokenSlice(tokens, start + count, end);
    }

    /**
     * @return The line of the first token, or of the last token before the slice if it is empty.
     */
    public int line() {
        if (!isEmpty()) {
            return tokens.get(start).line();
        }
        if (start > 0) {
            return tokens.get(start - 1).line();
        }
        return tokens.isEmpty() ? 0 : tokens.get(0).line();
    }
}
