package org.lpreader.frontend.token;

/**
 * Defines the semantic token kinds produced by the
 * {@link org.lpreader.frontend.classifier.TokenClassifier}.
 */
public enum TokenType {
    /** A section keyword such as "minimize" or "subject to". Payload: {@link SectionKeyword}. */
    SECTION,
    /** A name followed by a colon. Payload: the name. */
    LABEL,
    /** A reference to a variable. Payload: the name. */
    VARIABLE,
    /** A numeric constant, sign already applied. Payload: the value. */
    NUMBER,
    /** The "free" marker of the bounds section. */
    FREE,
    /** A comparison operator. Payload: {@link ComparisonType}. */
    COMPARISON,
    /** An "S1::" or "S2::" marker. Payload: 1 or 2. */
    SOS_TYPE,
    /** The '[' opening a quadratic block. */
    BRACKET_OPEN,
    /** The ']' closing a quadratic block. */
    BRACKET_CLOSE,
    /** The '/' after a quadratic block of the objective. */
    SLASH,
    /** The '*' between the factors of a product. */
    ASTERISK,
    /** The '^' of a square. */
    CARET
}
