package org.lpreader.frontend.parser.features.constraints;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.frontend.parser.ParseResult;
import org.lpreader.frontend.sections.ISectionHandler;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.token.ComparisonType;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.frontend.token.Token;
import org.lpreader.frontend.token.TokenType;
import org.lpreader.model.Constraint;
import org.lpreader.model.Expression;

/**
 * Handles the <code>subject to</code> section.
 * Each constraint has the form {@code [name:] expression (<= | = | >=) constant}.
 */
public class ConstraintSectionHandler implements ISectionHandler {

    @Override
    public void process(SectionKeyword keyword, TokenSlice slice, SectionContext context) throws LpReadException {
        TokenSlice rest = slice;
        while (!rest.isEmpty()) {
            ParseResult<Constraint> result = parseConstraint(rest, context);
            context.getBuilder().addConstraint(result.value());
            rest = result.remaining();
        }
    }

    /**
     * Parses one constraint from the front of a slice.
     * @param slice The remaining tokens of the section.
     * @param context The section context.
     * @return The constraint and the tokens after its right-hand side.
     * @throws LpReadException if the constraint is incomplete or malformed.
     */
    ParseResult<Constraint> parseConstraint(TokenSlice slice, SectionContext context) throws LpReadException {
        ParseResult<Expression> parsed = context.getExpressionParser().parse(slice, false);
        TokenSlice rest = parsed.remaining();

        if (rest.isEmpty()) {
            throw context.error(LpErrorCode.UNEXPECTED_END_OF_SECTION,
                    "Constraint has no comparison operator", rest.line());
        }
        Token operator = rest.first();
        if (!operator.is(TokenType.COMPARISON)) {
            throw context.getExpressionParser().unexpectedToken(operator, "constraint");
        }
        ComparisonType comparison = operator.comparison();
        if (comparison.isStrict()) {
            throw context.error(LpErrorCode.UNEXPECTED_TOKEN,
                    "Strict comparison '" + comparison.symbol() + "' is not allowed in a constraint", operator.line());
        }

        rest = rest.advance(1);
        if (rest.isEmpty()) {
            throw context.error(LpErrorCode.UNEXPECTED_END_OF_SECTION,
                    "Constraint has no right-hand side", operator.line());
        }
        Token rhs = rest.first();
        if (!rhs.is(TokenType.NUMBER)) {
            throw context.error(LpErrorCode.UNEXPECTED_TOKEN,
                    "Expected a constant right-hand side but found " + rhs, rhs.line());
        }

        double value = rhs.number();
        double lower = Double.NEGATIVE_INFINITY;
        double upper = Double.POSITIVE_INFINITY;
        switch (comparison) {
            case LESS_EQUAL -> upper = value;
            case GREATER_EQUAL -> lower = value;
            case EQUAL -> {
                lower = value;
                upper = value;
            }
            default -> throw new IllegalStateException("Unhandled comparison " + comparison);
        }
        return new ParseResult<>(new Constraint(parsed.value(), lower, upper), rest.advance(1));
    }
}
