package org.lpreader.frontend.parser.features.bounds;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.frontend.sections.ISectionHandler;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.semantics.VariableEntry;
import org.lpreader.frontend.token.ComparisonType;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.frontend.token.Token;

import static org.lpreader.frontend.token.TokenType.COMPARISON;
import static org.lpreader.frontend.token.TokenType.FREE;
import static org.lpreader.frontend.token.TokenType.NUMBER;
import static org.lpreader.frontend.token.TokenType.VARIABLE;

/**
 * Handles the <code>bounds</code> section. Each entry takes one of the forms
 * <pre>
 *   x free
 *   l &lt;= x &lt;= u
 *   c (&lt;= | = | &gt;=) x
 *   x (&lt;= | = | &gt;=) c
 * </pre>
 * Later entries for the same variable overwrite the bounds they mention.
 */
public class BoundsSectionHandler implements ISectionHandler {

    @Override
    public void process(SectionKeyword keyword, TokenSlice slice, SectionContext context) throws LpReadException {
        TokenSlice rest = slice;
        while (!rest.isEmpty()) {
            rest = applyBound(rest, context);
        }
    }

    /**
     * Applies the bound at the front of a slice.
     * @param slice The remaining tokens of the section.
     * @param context The section context.
     * @return The tokens after the bound.
     * @throws LpReadException if no bound form matches.
     */
    TokenSlice applyBound(TokenSlice slice, SectionContext context) throws LpReadException {
        if (slice.startsWith(VARIABLE, FREE)) {
            variable(slice.peek(0), context).setBounds(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
            return slice.advance(2);
        }

        if (slice.startsWith(NUMBER, COMPARISON, VARIABLE, COMPARISON, NUMBER)) {
            Token left = slice.peek(1);
            Token right = slice.peek(3);
            if (left.comparison() != ComparisonType.LESS_EQUAL || right.comparison() != ComparisonType.LESS_EQUAL) {
                throw context.error(LpErrorCode.MALFORMED_BOUND,
                        "A double bound must have the form 'l <= x <= u'", slice.line());
            }
            variable(slice.peek(2), context).setBounds(slice.peek(0).number(), slice.peek(4).number());
            return slice.advance(5);
        }

        if (slice.startsWith(NUMBER, COMPARISON, VARIABLE)) {
            double value = slice.peek(0).number();
            VariableEntry var = variable(slice.peek(2), context);
            switch (nonStrict(slice.peek(1), context)) {
                case LESS_EQUAL -> var.setLowerBound(value);
                case GREATER_EQUAL -> var.setUpperBound(value);
                default -> var.setBounds(value, value);
            }
            return slice.advance(3);
        }

        if (slice.startsWith(VARIABLE, COMPARISON, NUMBER)) {
            double value = slice.peek(2).number();
            VariableEntry var = variable(slice.peek(0), context);
            switch (nonStrict(slice.peek(1), context)) {
                case LESS_EQUAL -> var.setUpperBound(value);
                case GREATER_EQUAL -> var.setLowerBound(value);
                default -> var.setBounds(value, value);
            }
            return slice.advance(3);
        }

        throw context.error(LpErrorCode.MALFORMED_BOUND, "Unrecognized bound starting with " + slice.first(), slice.line());
    }

    private ComparisonType nonStrict(Token operator, SectionContext context) throws LpReadException {
        ComparisonType comparison = operator.comparison();
        if (comparison.isStrict()) {
            throw context.error(LpErrorCode.MALFORMED_BOUND,
                    "Strict comparison '" + comparison.symbol() + "' is not allowed in a bound", operator.line());
        }
        return comparison;
    }

    private VariableEntry variable(Token token, SectionContext context) {
        return context.getSymbolTable().resolveVariable(token.name());
    }
}
