package org.lpreader.frontend.parser.features.sos;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.frontend.parser.ParseResult;
import org.lpreader.frontend.sections.ISectionHandler;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.frontend.token.Token;
import org.lpreader.frontend.token.TokenType;
import org.lpreader.model.SosEntry;
import org.lpreader.model.SpecialOrderedSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the <code>sos</code> section. Each set is written as
 * <pre>
 *   name: S1:: x1:1 x2:2 x3:3
 * </pre>
 * Entries are read while a label is followed by a number. A label that is not
 * followed by a number starts the next set.
 */
public class SosSectionHandler implements ISectionHandler {

    @Override
    public void process(SectionKeyword keyword, TokenSlice slice, SectionContext context) throws LpReadException {
        TokenSlice rest = slice;
        while (!rest.isEmpty()) {
            ParseResult<SpecialOrderedSet> result = parseSet(rest, context);
            context.getBuilder().addSpecialOrderedSet(result.value());
            rest = result.remaining();
        }
    }

    ParseResult<SpecialOrderedSet> parseSet(TokenSlice slice, SectionContext context) throws LpReadException {
        Token name = slice.first();
        if (!name.is(TokenType.LABEL)) {
            throw context.error(LpErrorCode.MALFORMED_SOS_ENTRY,
                    "Expected the name of a set but found " + name, name.line());
        }

        TokenSlice rest = slice.advance(1);
        if (rest.isEmpty()) {
            throw context.error(LpErrorCode.UNEXPECTED_END_OF_SECTION,
                    "Set '" + name.name() + "' has no type", name.line());
        }
        Token type = rest.first();
        if (!type.is(TokenType.SOS_TYPE)) {
            throw context.error(LpErrorCode.MALFORMED_SOS_ENTRY,
                    "Expected S1:: or S2:: after set '" + name.name() + "' but found " + type, type.line());
        }
        rest = rest.advance(1);

        List<SosEntry> entries = new ArrayList<>();
        while (rest.startsWith(TokenType.LABEL, TokenType.NUMBER)) {
            int variable = context.getSymbolTable().resolveVariable(rest.peek(0).name()).handle();
            entries.add(new SosEntry(variable, rest.peek(1).number()));
            rest = rest.advance(2);
        }
        return new ParseResult<>(new SpecialOrderedSet(name.name(), type.sosType(), entries), rest);
    }
}
