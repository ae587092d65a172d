package org.lpreader.frontend.lexer;

/**
 * Defines the raw token kinds that the {@link Lexer} can produce.
 */
public enum RawTokenType {
    // Single-character tokens.
    /** The '<' character. */
    LESS,
    /** The '>' character. */
    GREATER,
    /** The '=' character. */
    EQUAL,
    /** The ':' character, used for labels and SOS types. */
    COLON,
    /** The '[' character, opening a quadratic block. */
    BRACKET_OPEN,
    /** The ']' character, closing a quadratic block. */
    BRACKET_CLOSE,
    /** The '+' character. */
    PLUS,
    /** The '-' character. */
    MINUS,
    /** The '^' character, used for squares. */
    CARET,
    /** The '/' character. */
    SLASH,
    /** The '*' character. */
    ASTERISK,

    // Literals.
    /** A run of name characters, such as a variable name or keyword. */
    STRING,
    /** A numeric literal without sign. */
    NUMBER,

    // Miscellaneous.
    /** Represents the end of the input. Returned forever once reached. */
    END_OF_FILE
}
