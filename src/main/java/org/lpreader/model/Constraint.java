package org.lpreader.model;

/**
 * A ranged constraint {@code lowerBound <= expression <= upperBound}.
 *
 * @param expression The constrained expression, carrying the constraint name if any.
 * @param lowerBound The lower bound, {@link Double#NEGATIVE_INFINITY} if absent.
 * @param upperBound The upper bound, {@link Double#POSITIVE_INFINITY} if absent.
 */
public record Constraint(Expression expression, double lowerBound, double upperBound) {

    public String name() {
        return expression.name();
    }

    public boolean isEquality() {
        return lowerBound == upperBound;
    }
}
