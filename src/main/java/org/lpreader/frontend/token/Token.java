package org.lpreader.frontend.token;

import java.util.Objects;

/**
 * Represents a single semantic token.
 * <p>
 * The payload depends on the {@link TokenType} and is only reachable through the
 * accessor matching that type; asking a token for the wrong payload is a programming
 * error and throws {@link IllegalStateException}.
 *
 * @param type The type of the token.
 * @param value The payload, or {@code null} for structural tokens.
 * @param line The 1-based line number where the token starts.
 */
public record Token(TokenType type, Object value, int line) {

    public Token {
        Objects.requireNonNull(type, "type");
    }

    public static Token section(SectionKeyword keyword, int line) {
        return new Token(TokenType.SECTION, Objects.requireNonNull(keyword), line);
    }

    public static Token label(String name, int line) {
        return new Token(TokenType.LABEL, Objects.requireNonNull(name), line);
    }

    public static Token variable(String name, int line) {
        return new Token(TokenType.VARIABLE, Objects.requireNonNull(name), line);
    }

    public static Token number(double value, int line) {
        return new Token(TokenType.NUMBER, value, line);
    }

    public static Token comparison(ComparisonType comparison, int line) {
        return new Token(TokenType.COMPARISON, Objects.requireNonNull(comparison), line);
    }

    public static Token sosType(int sosType, int line) {
        return new Token(TokenType.SOS_TYPE, sosType, line);
    }

    /**
     * Creates a token without payload.
     * @param type One of the structural types or {@link TokenType#FREE}.
     * @param line The line number.
     * @return The token.
     */
    public static Token of(TokenType type, int line) {
        return new Token(type, null, line);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * @return The name of a {@link TokenType#LABEL} or {@link TokenType#VARIABLE} token.
     */
    public String name() {
        if (type != TokenType.LABEL && type != TokenType.VARIABLE) {
            throw new IllegalStateException("Token " + type + " carries no name");
        }
        return (String) value;
    }

    public double number() {
        expect(TokenType.NUMBER);
        return (Double) value;
    }

    public SectionKeyword keyword() {
        expect(TokenType.SECTION);
        return (SectionKeyword) value;
    }

    public ComparisonType comparison() {
        expect(TokenType.COMPARISON);
        return (ComparisonType) value;
    }

    public int sosType() {
        expect(TokenType.SOS_TYPE);
        return (Integer) value;
    }

    private void expect(TokenType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected a " + expected + " token but was " + type);
        }
    }

    @Override
    public String toString() {
        return value == null ? type.toString() : type + "(" + value + ")";
    }
}
