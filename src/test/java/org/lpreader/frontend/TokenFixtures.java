package org.lpreader.frontend;

import org.lpreader.api.LpReadException;
import org.lpreader.config.ReaderOptions;
import org.lpreader.frontend.classifier.TokenClassifier;
import org.lpreader.frontend.lexer.Lexer;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.semantics.ModelBuilder;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.frontend.token.Token;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.List;
import java.util.Set;

/**
 * Shortcuts for turning LP snippets into the inputs of the later pipeline stages.
 */
public final class TokenFixtures {

    public static final String SOURCE = "test.lp";

    private TokenFixtures() {}

    public static Lexer lexer(String source) throws LpReadException {
        return new Lexer(new BufferedReader(new StringReader(source)), SOURCE);
    }

    public static List<Token> classify(String source) throws LpReadException {
        return List.copyOf(new TokenClassifier(lexer(source), false).classify());
    }

    public static TokenSlice slice(String source) throws LpReadException {
        return TokenSlice.of(classify(source));
    }

    public static SectionContext context(SectionKeyword... presentSections) {
        return context(ReaderOptions.defaults(), presentSections);
    }

    public static SectionContext context(ReaderOptions options, SectionKeyword... presentSections) {
        return new SectionContext(new ModelBuilder(), Set.of(presentSections), options, SOURCE);
    }
}
