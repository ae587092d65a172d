package org.lpreader.model;

/**
 * A coefficient times the product of two variables.
 *
 * @param coefficient The coefficient.
 * @param variable1 The handle of the first variable.
 * @param variable2 The handle of the second variable.
 */
public record QuadraticTerm(double coefficient, int variable1, int variable2) {

    /**
     * @return true if both factors are the same variable.
     */
    public boolean isSquare() {
        return variable1 == variable2;
    }
}
