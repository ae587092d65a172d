package org.lpreader.api;

/**
 * Defines unique, testable error codes for every way a read can fail.
 * This decouples the test logic from the wording of error messages.
 */
public enum LpErrorCode {
    // region Input Errors
    /** The input file does not exist or cannot be opened. */
    UNOPENABLE_INPUT,
    /** An I/O error occurred while reading an already opened input. */
    IO_ERROR_READING_INPUT,
    // endregion

    // region Lexer & Classifier Errors
    /** A character that cannot start any raw token. */
    UNEXPECTED_CHARACTER,
    /** A raw token sequence that has no meaning in the format. */
    UNKNOWN_TOKEN,
    // endregion

    // region Structure Errors
    /** A section keyword appeared a second time, or both objective senses were given. */
    DUPLICATE_SECTION,
    /** A section ended where more tokens were required. */
    UNEXPECTED_END_OF_SECTION,
    /** A well-formed token that is not allowed at its position. */
    UNEXPECTED_TOKEN,
    // endregion

    // region Grammar Errors
    /** A bad quadratic pattern, a wrong exponent or an unsupported sign/bracket combination. */
    MALFORMED_EXPRESSION,
    /** A bound declaration that matches none of the bound forms. */
    MALFORMED_BOUND,
    /** A special ordered set whose header or entries are malformed. */
    MALFORMED_SOS_ENTRY
    // endregion
}
