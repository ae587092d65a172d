package org.lpreader.frontend.parser;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.frontend.TokenFixtures;
import org.lpreader.frontend.semantics.SymbolTable;
import org.lpreader.frontend.token.TokenType;
import org.lpreader.model.Expression;
import org.lpreader.model.LinearTerm;
import org.lpreader.model.QuadraticTerm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link ExpressionParser}, covering the linear term
 * patterns and the quadratic block forms in objectives and constraints.
 * These are unit tests and do not require external resources.
 */
public class ExpressionParserTest {

    private SymbolTable symbols;
    private ExpressionParser parser;

    @BeforeEach
    void setUp() {
        symbols = new SymbolTable();
        parser = new ExpressionParser(symbols, TokenFixtures.SOURCE);
    }

    private int handle(String name) {
        return symbols.lookup(name).orElseThrow().handle();
    }

    private LpErrorCode failure(String source, boolean objective) {
        LpReadException e = catchThrowableOfType(() -> parser.parse(TokenFixtures.slice(source), objective), LpReadException.class);
        assertThat(e).as("expected a read error for '%s'", source).isNotNull();
        return e.getErrorCode();
    }

    /**
     * Verifies that a labelled linear expression yields its name, offset and terms in written order.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testLinearExpression() throws LpReadException {
        ParseResult<Expression> result = parser.parse(TokenFixtures.slice("cost: 2 x + 3 y - z + 5"), false);

        Expression expression = result.value();
        assertThat(result.remaining().isEmpty()).isTrue();
        assertThat(expression.name()).isEqualTo("cost");
        assertThat(expression.offset()).isEqualTo(5.0);
        assertThat(expression.linearTerms()).containsExactly(
                new LinearTerm(2.0, handle("x")),
                new LinearTerm(3.0, handle("y")),
                new LinearTerm(-1.0, handle("z")));
        assertThat(expression.isQuadratic()).isFalse();
    }

    /**
     * Verifies that several lone constants add up to the offset.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testOffsetsAccumulate() throws LpReadException {
        Expression expression = parser.parse(TokenFixtures.slice("3 + x - 1"), false).value();

        assertThat(expression.hasName()).isFalse();
        assertThat(expression.offset()).isEqualTo(2.0);
    }

    /**
     * Verifies that a name used twice refers to the same variable handle.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testRepeatedVariableSharesHandle() throws LpReadException {
        Expression expression = parser.parse(TokenFixtures.slice("x + 2 x"), false).value();

        assertThat(expression.linearTerms()).extracting(LinearTerm::variable).containsExactly(0, 0);
        assertThat(symbols.size()).isEqualTo(1);
    }

    /**
     * Verifies that parsing stops in front of a comparison and leaves it for the caller.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testStopsAtComparison() throws LpReadException {
        ParseResult<Expression> result = parser.parse(TokenFixtures.slice("x + y <= 4"), false);

        assertThat(result.value().linearTerms()).hasSize(2);
        assertThat(result.remaining().first().is(TokenType.COMPARISON)).isTrue();
    }

    /**
     * Verifies the square and product forms inside an objective block divided by two.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testQuadraticObjective() throws LpReadException {
        ParseResult<Expression> result = parser.parse(
                TokenFixtures.slice("x + [ x ^ 2 + 3 x * y - 2 y ^ 2 ] / 2"), true);

        assertThat(result.remaining().isEmpty()).isTrue();
        assertThat(result.value().quadraticTerms()).containsExactly(
                new QuadraticTerm(1.0, handle("x"), handle("x")),
                new QuadraticTerm(3.0, handle("x"), handle("y")),
                new QuadraticTerm(-2.0, handle("y"), handle("y")));
        assertThat(result.value().quadraticTerms().get(0).isSquare()).isTrue();
    }

    /**
     * Verifies that an omitted coefficient inside a quadratic block defaults to one.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testSquareWithoutCoefficient() throws LpReadException {
        Expression expression = parser.parse(TokenFixtures.slice("[ x ^ 2 ] / 2"), true).value();

        assertThat(expression.quadraticTerms()).containsExactly(new QuadraticTerm(1.0, handle("x"), handle("x")));
    }

    /**
     * Verifies that a quadratic block in a constraint ends at the closing bracket.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testQuadraticConstraintHasNoDivisor() throws LpReadException {
        ParseResult<Expression> result = parser.parse(TokenFixtures.slice("[ x * y ] <= 1"), false);

        assertThat(result.value().quadraticTerms()).hasSize(1);
        assertThat(result.remaining().first().is(TokenType.COMPARISON)).isTrue();
    }

    /**
     * Verifies that a divisor after a constraint block is not consumed, so the caller rejects it.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testDivisorInConstraintIsLeftUnconsumed() throws LpReadException {
        ParseResult<Expression> result = parser.parse(TokenFixtures.slice("[ x ^ 2 ] / 2"), false);

        assertThat(result.remaining().first().is(TokenType.SLASH)).isTrue();
    }

    /**
     * Verifies that an objective block must be followed by a division by exactly two.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testMissingDivisorInObjective() {
        assertThat(failure("[ x ^ 2 ]", true)).isEqualTo(LpErrorCode.MALFORMED_EXPRESSION);
        assertThat(failure("[ x ^ 2 ] / 3", true)).isEqualTo(LpErrorCode.MALFORMED_EXPRESSION);
    }

    /**
     * Verifies that exponents other than two are rejected.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testOnlySquaresAreSupported() {
        assertThat(failure("[ x ^ 3 ] / 2", true)).isEqualTo(LpErrorCode.MALFORMED_EXPRESSION);
        assertThat(failure("[ 2 x ^ 1 ]", false)).isEqualTo(LpErrorCode.MALFORMED_EXPRESSION);
    }

    /**
     * Verifies that a linear term inside a block and a missing closing bracket are rejected.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testMalformedQuadraticBlock() {
        assertThat(failure("[ x + y ]", false)).isEqualTo(LpErrorCode.MALFORMED_EXPRESSION);
        assertThat(failure("[ x ^ 2", false)).isEqualTo(LpErrorCode.UNEXPECTED_END_OF_SECTION);
    }

    /**
     * Verifies that {@code x1 3*x2} stops at the star, which is then reported as malformed.
     * This is a unit test for the expression parser.
     */
    @Test
    @Tag("unit")
    void testAdjacentTermsStopAtOperator() throws LpReadException {
        ParseResult<Expression> result = parser.parse(TokenFixtures.slice("x1 3*x2"), false);

        assertThat(result.remaining().first().is(TokenType.ASTERISK)).isTrue();
        assertThat(parser.unexpectedToken(result.remaining().first(), "constraint").getErrorCode())
                .isEqualTo(LpErrorCode.MALFORMED_EXPRESSION);
    }
}
