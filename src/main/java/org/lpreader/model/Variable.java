package org.lpreader.model;

/**
 * A decision variable of the model.
 *
 * @param name The unique name of the variable.
 * @param lowerBound The lower bound, {@link Double#NEGATIVE_INFINITY} if unbounded.
 * @param upperBound The upper bound, {@link Double#POSITIVE_INFINITY} if unbounded.
 * @param type The domain of the variable.
 */
public record Variable(String name, double lowerBound, double upperBound, VariableType type) {

    /**
     * @return true if the variable may only take integral values when nonzero.
     */
    public boolean isInteger() {
        return type == VariableType.BINARY || type == VariableType.GENERAL || type == VariableType.SEMIINTEGER;
    }
}
