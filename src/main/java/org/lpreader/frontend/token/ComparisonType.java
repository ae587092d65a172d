package org.lpreader.frontend.token;

/**
 * The comparison operators of the format.
 */
public enum ComparisonType {
    LESS_EQUAL("<="),
    LESS("<"),
    EQUAL("="),
    GREATER(">"),
    GREATER_EQUAL(">=");

    private final String symbol;

    ComparisonType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return true for {@code <} and {@code >}, which constraints and bounds reject.
     */
    public boolean isStrict() {
        return this == LESS || this == GREATER;
    }
}
