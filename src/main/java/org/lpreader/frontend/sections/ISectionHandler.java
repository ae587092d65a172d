package org.lpreader.frontend.sections;

import org.lpreader.api.LpReadException;
import org.lpreader.frontend.token.SectionKeyword;

/**
 * The base interface for all section handlers.
 * Each handler applies the grammar of one kind of section to that section's tokens
 * and records the result in the model under construction.
 */
public interface ISectionHandler {

    /**
     * Processes the tokens of one section. Only called for sections that are present
     * and non-empty; the whole slice must be consumed or rejected.
     *
     * @param keyword The keyword the section was opened with.
     * @param slice The tokens of the section.
     * @param context Access to the model builder, the other sections and the options.
     * @throws LpReadException if the tokens do not follow the section's grammar.
     */
    void process(SectionKeyword keyword, TokenSlice slice, SectionContext context) throws LpReadException;
}
