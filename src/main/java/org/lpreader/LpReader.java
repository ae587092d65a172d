package org.lpreader;

import org.lpreader.api.ILpReader;
import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.config.ReaderOptions;
import org.lpreader.diagnostics.ReaderLogger;
import org.lpreader.frontend.classifier.TokenClassifier;
import org.lpreader.frontend.lexer.Lexer;
import org.lpreader.frontend.sections.ISectionHandler;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.sections.SectionHandlerRegistry;
import org.lpreader.frontend.sections.SectionSplitter;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.semantics.ModelBuilder;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.frontend.token.Token;
import org.lpreader.model.Model;
import org.lpreader.util.compression.CompressionCodecFactory;
import org.lpreader.util.compression.CompressionException;
import org.lpreader.util.compression.ICompressionCodec;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The main reader implementation. This class orchestrates the pipeline from raw
 * characters to a {@link Model}: lexing, token classification, section splitting
 * and the section handlers. It is not thread-safe; every read starts from empty state.
 */
public class LpReader implements ILpReader {

    private final ReaderOptions options;
    private final SectionHandlerRegistry handlers = SectionHandlerRegistry.initialize();
    private int verbosity;

    /**
     * Creates a reader with the options from the classpath {@code reference.conf}.
     */
    public LpReader() {
        this(ReaderOptions.defaults());
    }

    /**
     * @param options The reader options.
     */
    public LpReader(ReaderOptions options) {
        this.options = options;
        this.verbosity = options.verbosity();
    }

    /**
     * {@inheritDoc}
     * <p>
     * The file may be compressed with any codec supported by {@link CompressionCodecFactory}.
     */
    @Override
    public Model read(Path file) throws LpReadException {
        try (InputStream in = open(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new LpReadException(LpErrorCode.IO_ERROR_READING_INPUT, "Failed to close " + file + ": " + e.getMessage(), e);
        }
    }

    private static InputStream open(Path file) throws LpReadException {
        try {
            return Files.newInputStream(file);
        } catch (IOException | SecurityException e) {
            throw new LpReadException(LpErrorCode.UNOPENABLE_INPUT, "Cannot open " + file + ": " + e, e);
        }
    }

    /**
     * {@inheritDoc}
     * <p>
     * The stream is decompressed according to the configured codec and decoded as strict UTF-8.
     * The decompressing and decoding layers are released, the caller's stream stays open.
     */
    @Override
    public Model read(InputStream in, String sourceName) throws LpReadException {
        InputStream buffered = new BufferedInputStream(new UnclosableInputStream(in));
        try {
            ICompressionCodec codec = CompressionCodecFactory.select(options.codec(), buffered);
            ReaderLogger.debug("Reading {} with codec {}", sourceName, codec.getName());
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(codec.wrapInputStream(buffered), decoder))) {
                return read(reader, sourceName);
            }
        } catch (CompressionException e) {
            throw new LpReadException(LpErrorCode.UNOPENABLE_INPUT,
                    "Cannot decompress " + sourceName + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new LpReadException(LpErrorCode.IO_ERROR_READING_INPUT,
                    "Failed to read " + sourceName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Model read(List<String> lines, String sourceName) throws LpReadException {
        return read(new BufferedReader(new StringReader(String.join("\n", lines))), sourceName);
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    // Shields the caller's stream from the close() that cascades down from the codec and reader layers.
    private static final class UnclosableInputStream extends FilterInputStream {

        UnclosableInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() {
        }
    }

    private Model read(BufferedReader reader, String sourceName) throws LpReadException {
        ReaderLogger.setLevel(verbosity);

        // Phase 1: Lexical analysis and classification
        Lexer lexer = new Lexer(reader, sourceName);
        List<Token> tokens = List.copyOf(new TokenClassifier(lexer, options.failOnUnterminatedComment()).classify());
        ReaderLogger.debug("{}: {} tokens", sourceName, tokens.size());

        // Phase 2: Section splitting
        Map<SectionKeyword, TokenSlice> sections = new SectionSplitter(sourceName).split(tokens);
        ReaderLogger.debug("{}: sections {}", sourceName, sections.keySet());

        // Phase 3: Section processing in registry order
        ModelBuilder builder = new ModelBuilder();
        SectionContext context = new SectionContext(builder, sections.keySet(), options, sourceName);
        for (Map.Entry<SectionKeyword, ISectionHandler> entry : handlers.entries().entrySet()) {
            TokenSlice slice = sections.get(entry.getKey());
            if (slice != null) {
                ReaderLogger.trace("{}: processing section {} ({} tokens)", sourceName, entry.getKey(), slice.size());
                entry.getValue().process(entry.getKey(), slice, context);
            }
        }

        Model model = builder.build();
        ReaderLogger.info("Read {}: {} variables, {} constraints, {} special ordered sets",
                sourceName, model.variableCount(), model.constraintCount(), model.specialOrderedSets().size());
        return model;
    }
}
