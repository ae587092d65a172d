package org.lpreader.frontend.lexer;

/**
 * Represents a single token extracted from the input by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token; empty for the end-of-file sentinel.
 * @param value The numeric value of a {@link RawTokenType#NUMBER} token, 0 otherwise.
 * @param line The 1-based line number where the token was found.
 */
public record RawToken(
        RawTokenType type,
        String text,
        double value,
        int line
) {

    public boolean is(RawTokenType expected) {
        return type == expected;
    }
}
