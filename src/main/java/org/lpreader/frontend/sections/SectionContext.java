package org.lpreader.frontend.sections;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.api.SourceInfo;
import org.lpreader.config.ReaderOptions;
import org.lpreader.frontend.parser.ExpressionParser;
import org.lpreader.frontend.semantics.ModelBuilder;
import org.lpreader.frontend.semantics.SymbolTable;
import org.lpreader.frontend.token.SectionKeyword;

import java.util.Set;

/**
 * Encapsulates the state shared by the section handlers of one read.
 */
public final class SectionContext {

    private final ModelBuilder builder;
    private final Set<SectionKeyword> presentSections;
    private final ReaderOptions options;
    private final String sourceName;
    private final ExpressionParser expressionParser;

    /**
     * @param builder The model under construction.
     * @param presentSections The sections that exist and are non-empty.
     * @param options The reader options.
     * @param sourceName The name of the input, for error reporting.
     */
    public SectionContext(ModelBuilder builder, Set<SectionKeyword> presentSections, ReaderOptions options, String sourceName) {
        this.builder = builder;
        this.presentSections = Set.copyOf(presentSections);
        this.options = options;
        this.sourceName = sourceName;
        this.expressionParser = new ExpressionParser(builder.getSymbolTable(), sourceName);
    }

    public ModelBuilder getBuilder() {
        return builder;
    }

    public SymbolTable getSymbolTable() {
        return builder.getSymbolTable();
    }

    public ExpressionParser getExpressionParser() {
        return expressionParser;
    }

    public ReaderOptions getOptions() {
        return options;
    }

    public String getSourceName() {
        return sourceName;
    }

    public boolean hasSection(SectionKeyword keyword) {
        return presentSections.contains(keyword);
    }

    /**
     * Creates an error pointing at a line of the input.
     * @param code The error category.
     * @param message The detail message.
     * @param line The 1-based line number.
     * @return The exception, ready to throw.
     */
    public LpReadException error(LpErrorCode code, String message, int line) {
        return new LpReadException(code, message, new SourceInfo(sourceName, line));
    }
}
