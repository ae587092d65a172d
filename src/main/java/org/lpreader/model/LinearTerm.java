package org.lpreader.model;

/**
 * A coefficient times one variable.
 *
 * @param coefficient The coefficient.
 * @param variable The handle of the variable, i.e. its index in {@link Model#variables()}.
 */
public record LinearTerm(double coefficient, int variable) {
}
