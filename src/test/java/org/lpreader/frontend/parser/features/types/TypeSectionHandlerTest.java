package org.lpreader.frontend.parser.features.types;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.config.ReaderOptions;
import org.lpreader.diagnostics.ReaderLogger;
import org.lpreader.frontend.TokenFixtures;
import org.lpreader.frontend.sections.SectionContext;
import org.lpreader.frontend.semantics.VariableEntry;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.junit.extensions.logging.ExpectLog;
import org.lpreader.junit.extensions.logging.LogLevel;
import org.lpreader.junit.extensions.logging.LogWatchExtension;
import org.lpreader.model.VariableType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the binary, general and semi-continuous section handlers.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class TypeSectionHandlerTest {

    private final SectionContext context = TokenFixtures.context(
            SectionKeyword.BINARY, SectionKeyword.GENERAL, SectionKeyword.SEMICONTINUOUS);

    private VariableEntry variable(String name) {
        return context.getSymbolTable().lookup(name).orElseThrow();
    }

    @Test
    void testBinaryOverridesBounds() throws LpReadException {
        context.getSymbolTable().resolveVariable("x").setBounds(2.0, 5.0);

        new BinarySectionHandler().process(SectionKeyword.BINARY, TokenFixtures.slice("x y"), context);

        assertThat(variable("x").type()).isEqualTo(VariableType.BINARY);
        assertThat(variable("x").lowerBound()).isEqualTo(0.0);
        assertThat(variable("x").upperBound()).isEqualTo(1.0);
        assertThat(variable("y").type()).isEqualTo(VariableType.BINARY);
    }

    @Test
    void testGeneralKeepsBounds() throws LpReadException {
        context.getSymbolTable().resolveVariable("n").setBounds(-3.0, 3.0);

        new GeneralSectionHandler().process(SectionKeyword.GENERAL, TokenFixtures.slice("n"), context);

        assertThat(variable("n").type()).isEqualTo(VariableType.GENERAL);
        assertThat(variable("n").lowerBound()).isEqualTo(-3.0);
    }

    @Test
    void testSemiContinuous() throws LpReadException {
        new SemiContinuousSectionHandler().process(SectionKeyword.SEMICONTINUOUS, TokenFixtures.slice("s"), context);

        assertThat(variable("s").type()).isEqualTo(VariableType.SEMICONTINUOUS);
    }

    @Test
    void testGeneralAndSemiContinuousMakeSemiInteger() throws LpReadException {
        new GeneralSectionHandler().process(SectionKeyword.GENERAL, TokenFixtures.slice("a b"), context);
        new SemiContinuousSectionHandler().process(SectionKeyword.SEMICONTINUOUS, TokenFixtures.slice("a c"), context);
        new GeneralSectionHandler().process(SectionKeyword.GENERAL, TokenFixtures.slice("c"), context);

        assertThat(variable("a").type()).isEqualTo(VariableType.SEMIINTEGER);
        assertThat(variable("b").type()).isEqualTo(VariableType.GENERAL);
        assertThat(variable("c").type()).isEqualTo(VariableType.SEMIINTEGER);
    }

    @Test
    void testOnlyVariablesAreAccepted() {
        LpReadException e = catchThrowableOfType(
                () -> new BinarySectionHandler().process(SectionKeyword.BINARY, TokenFixtures.slice("x 3"), context),
                LpReadException.class);

        assertThat(e.getErrorCode()).isEqualTo(LpErrorCode.UNEXPECTED_TOKEN);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ReaderLogger", messagePattern = "Skipping semi-continuous section of test.lp.*")
    void testLegacyGuardSkipsSectionWithoutGeneral() throws LpReadException {
        ReaderLogger.setLevel(ReaderLogger.INFO);
        SectionContext legacy = TokenFixtures.context(
                ReaderOptions.defaults().withLegacySemiSectionGuard(true), SectionKeyword.SEMICONTINUOUS);

        new SemiContinuousSectionHandler().process(SectionKeyword.SEMICONTINUOUS, TokenFixtures.slice("s"), legacy);

        assertThat(legacy.getSymbolTable().lookup("s")).isEmpty();
    }

    @Test
    void testLegacyGuardWithGeneralPresent() throws LpReadException {
        SectionContext legacy = TokenFixtures.context(ReaderOptions.defaults().withLegacySemiSectionGuard(true),
                SectionKeyword.GENERAL, SectionKeyword.SEMICONTINUOUS);

        new SemiContinuousSectionHandler().process(SectionKeyword.SEMICONTINUOUS, TokenFixtures.slice("s"), legacy);

        assertThat(legacy.getSymbolTable().lookup("s").orElseThrow().type()).isEqualTo(VariableType.SEMICONTINUOUS);
    }
}
