package org.lpreader.model;

import java.util.List;

/**
 * A linear plus quadratic arithmetic expression.
 * The objective's quadratic terms are already divided by two: {@code [ x^2 ] / 2}
 * yields one term with coefficient 1.0 as written inside the brackets.
 *
 * @param name The optional label of the expression, or {@code null}.
 * @param offset The constant part.
 * @param linearTerms The linear terms in the order they were written.
 * @param quadraticTerms The quadratic terms in the order they were written.
 */
public record Expression(String name, double offset, List<LinearTerm> linearTerms, List<QuadraticTerm> quadraticTerms) {

    public Expression {
        linearTerms = List.copyOf(linearTerms);
        quadraticTerms = List.copyOf(quadraticTerms);
    }

    /**
     * @return An unnamed expression without terms.
     */
    public static Expression empty() {
        return new Expression(null, 0.0, List.of(), List.of());
    }

    public boolean hasName() {
        return name != null;
    }

    public boolean isQuadratic() {
        return !quadraticTerms.isEmpty();
    }
}
