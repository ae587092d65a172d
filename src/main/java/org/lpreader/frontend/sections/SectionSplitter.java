package org.lpreader.frontend.sections;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.api.SourceInfo;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.frontend.token.Token;
import org.lpreader.frontend.token.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions the semantic token stream into one slice per section.
 * <p>
 * A section runs from the token after its keyword to the next section keyword or the
 * end of the stream. Sections without tokens are not recorded. Tokens in front of the
 * first keyword are recorded under {@link SectionKeyword#NONE}.
 */
public class SectionSplitter {

    private final String sourceName;

    /**
     * @param sourceName The name of the input, for error reporting.
     */
    public SectionSplitter(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Splits the tokens in a single left-to-right scan.
     * @param tokens The classified tokens; the list must not be modified afterwards.
     * @return An unmodifiable map from section keyword to its non-empty slice.
     * @throws LpReadException if a section keyword occurs more than once, or both objective senses occur.
     */
    public Map<SectionKeyword, TokenSlice> split(List<Token> tokens) throws LpReadException {
        Map<SectionKeyword, TokenSlice> sections = new EnumMap<>(SectionKeyword.class);
        Set<SectionKeyword> seen = EnumSet.noneOf(SectionKeyword.class);

        SectionKeyword current = SectionKeyword.NONE;
        int sectionStart = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.is(TokenType.SECTION)) {
                continue;
            }
            record(sections, current, tokens, sectionStart, i);

            current = token.keyword();
            if (!seen.add(current)) {
                throw new LpReadException(LpErrorCode.DUPLICATE_SECTION,
                        "Section " + current + " appears more than once", new SourceInfo(sourceName, token.line()));
            }
            if (seen.contains(SectionKeyword.MINIMIZE) && seen.contains(SectionKeyword.MAXIMIZE)) {
                throw new LpReadException(LpErrorCode.DUPLICATE_SECTION,
                        "Only one of the minimize and maximize sections may be given", new SourceInfo(sourceName, token.line()));
            }
            sectionStart = i + 1;
        }
        record(sections, current, tokens, sectionStart, tokens.size());
        return Collections.unmodifiableMap(sections);
    }

    private void record(Map<SectionKeyword, TokenSlice> sections, SectionKeyword keyword, List<Token> tokens, int start, int end) {
        if (end > start) {
            sections.put(keyword, new TokenSlice(tokens, start, end));
        }
    }
}
