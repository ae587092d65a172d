package org.lpreader.frontend.parser.features.end;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.frontend.sections.ISectionHandler;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.token.SectionKeyword;

/**
 * Rejects content outside of any section: tokens before the first section keyword
 * and tokens after <code>end</code>.
 */
public class EndSectionHandler implements ISectionHandler {

    @Override
    public void process(SectionKeyword keyword, TokenSlice slice, SectionContext context) throws LpReadException {
        String where = keyword == SectionKeyword.END ? "after 'end'" : "before the first section";
        throw context.error(LpErrorCode.UNEXPECTED_TOKEN,
                "Unexpected " + slice.first() + " " + where, slice.line());
    }
}
