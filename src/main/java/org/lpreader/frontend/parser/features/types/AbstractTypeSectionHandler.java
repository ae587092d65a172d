package org.lpreader.frontend.parser.features.types;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.frontend.sections.ISectionHandler;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.semantics.VariableEntry;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.frontend.token.Token;
import org.lpreader.frontend.token.TokenType;

/**
 * Base class for the sections that are plain lists of variable names.
 */
abstract class AbstractTypeSectionHandler implements ISectionHandler {

    @Override
    public void process(SectionKeyword keyword, TokenSlice slice, SectionContext context) throws LpReadException {
        for (TokenSlice rest = slice; !rest.isEmpty(); rest = rest.advance(1)) {
            Token token = rest.first();
            if (!token.is(TokenType.VARIABLE)) {
                throw context.error(LpErrorCode.UNEXPECTED_TOKEN,
                        "Expected a variable name in section " + keyword + " but found " + token, token.line());
            }
            apply(context.getSymbolTable().resolveVariable(token.name()));
        }
    }

    /**
     * Applies the section's declaration to one listed variable.
     * @param variable The variable, created if this is its first reference.
     */
    protected abstract void apply(VariableEntry variable);
}
