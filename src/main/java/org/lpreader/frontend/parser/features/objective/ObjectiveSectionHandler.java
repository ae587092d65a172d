package org.lpreader.frontend.parser.features.objective;

import org.lpreader.api.LpReadException;
import org.lpreader.frontend.parser.ParseResult;
import org.lpreader.frontend.sections.ISectionHandler;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.model.Expression;
import org.lpreader.model.ObjectiveSense;

/**
 * Handles the <code>minimize</code> and <code>maximize</code> sections.
 * The section holds exactly one expression, optionally labelled, and nothing else.
 */
public class ObjectiveSectionHandler implements ISectionHandler {

    @Override
    public void process(SectionKeyword keyword, TokenSlice slice, SectionContext context) throws LpReadException {
        ParseResult<Expression> result = context.getExpressionParser().parse(slice, true);
        TokenSlice rest = result.remaining();
        if (!rest.isEmpty()) {
            throw context.getExpressionParser().unexpectedToken(rest.first(), "objective");
        }

        ObjectiveSense sense = keyword == SectionKeyword.MAXIMIZE ? ObjectiveSense.MAXIMIZE : ObjectiveSense.MINIMIZE;
        context.getBuilder().setObjective(sense, result.value());
    }
}
