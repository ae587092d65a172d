package org.lpreader.frontend.parser.features.types;

import org.lpreader.api.LpReadException;
import org.lpreader.diagnostics.ReaderLogger;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.semantics.VariableEntry;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.model.VariableType;

/**
 * Handles the <code>semi-continuous</code> section. A variable that is already
 * general becomes semi-integer.
 */
public class SemiContinuousSectionHandler extends AbstractTypeSectionHandler {

    @Override
    public void process(SectionKeyword keyword, TokenSlice slice, SectionContext context) throws LpReadException {
        if (context.getOptions().legacySemiSectionGuard() && !context.hasSection(SectionKeyword.GENERAL)) {
            ReaderLogger.warn("Skipping semi-continuous section of {}: legacy mode requires a general section",
                    context.getSourceName());
            return;
        }
        super.process(keyword, slice, context);
    }

    @Override
    protected void apply(VariableEntry variable) {
        variable.setType(variable.type() == VariableType.GENERAL
                ? VariableType.SEMIINTEGER
                : VariableType.SEMICONTINUOUS);
    }
}
