package org.lpreader;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.config.ReaderOptions;
import org.lpreader.junit.extensions.logging.ExpectLog;
import org.lpreader.junit.extensions.logging.LogLevel;
import org.lpreader.junit.extensions.logging.LogWatchExtension;
import org.lpreader.model.Constraint;
import org.lpreader.model.LinearTerm;
import org.lpreader.model.Model;
import org.lpreader.model.ObjectiveSense;
import org.lpreader.model.QuadraticTerm;
import org.lpreader.model.SosEntry;
import org.lpreader.model.SpecialOrderedSet;
import org.lpreader.model.Variable;
import org.lpreader.model.VariableType;
import org.lpreader.util.compression.GzipCodec;
import org.lpreader.util.compression.ICompressionCodec;
import org.lpreader.util.compression.ZstdCodec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * End-to-end tests of the {@link LpReader} pipeline on complete LP inputs.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class LpReaderTest {

    private final LpReader reader = new LpReader();

    @TempDir
    Path tempDir;

    private Model read(String... lines) throws LpReadException {
        return reader.read(List.of(lines), "test.lp");
    }

    private LpReadException failure(String... lines) {
        LpReadException e = catchThrowableOfType(() -> read(lines), LpReadException.class);
        assertThat(e).as("expected a read error").isNotNull();
        return e;
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(LpReaderTest.class.getResource("/org/lpreader/" + name).toURI());
    }

    private Path compress(Path source, ICompressionCodec codec) throws IOException {
        Path target = tempDir.resolve(source.getFileName() + codec.getFileExtension());
        try (OutputStream out = codec.wrapOutputStream(Files.newOutputStream(target))) {
            Files.copy(source, out);
        }
        return target;
    }

    private static Variable variable(Model model, String name) {
        return model.findVariable(name).orElseThrow();
    }

    @Test
    void testReadsCompleteModel() throws Exception {
        Model model = reader.read(resource("production.lp"));

        assertThat(model.sense()).isEqualTo(ObjectiveSense.MAXIMIZE);
        assertThat(model.objective().name()).isEqualTo("profit");
        assertThat(model.objective().linearTerms()).extracting(LinearTerm::coefficient).containsExactly(3.0, 2.0, -4.0);
        assertThat(model.objective().quadraticTerms()).containsExactly(
                new QuadraticTerm(1.0, 0, 0), new QuadraticTerm(2.0, 0, 1));

        assertThat(model.constraints()).extracting(Constraint::name).containsExactly("c1", "c2", "c3", "c4");
        assertThat(model.constraints().get(1).lowerBound()).isEqualTo(-2.0);
        assertThat(model.constraints().get(2).isEquality()).isTrue();
        assertThat(model.constraints().get(3).expression().isQuadratic()).isTrue();

        assertThat(model.variables()).extracting(Variable::name).containsExactly("x1", "x2", "x3", "x4", "y", "b", "s");
        assertThat(variable(model, "x1")).isEqualTo(new Variable("x1", 0.0, 40.0, VariableType.CONTINUOUS));
        assertThat(variable(model, "x2")).isEqualTo(new Variable("x2", 0.0, 30.0, VariableType.GENERAL));
        assertThat(variable(model, "x3").lowerBound()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(variable(model, "x4").lowerBound()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(variable(model, "x4").upperBound()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(variable(model, "y").lowerBound()).isEqualTo(-5.0);
        assertThat(variable(model, "b")).isEqualTo(new Variable("b", 0.0, 1.0, VariableType.BINARY));
        assertThat(variable(model, "s").type()).isEqualTo(VariableType.SEMICONTINUOUS);

        assertThat(model.specialOrderedSets()).extracting(SpecialOrderedSet::name).containsExactly("set1", "set2");
        assertThat(model.specialOrderedSets().get(1).type()).isEqualTo(2);
    }

    @Test
    void testUnreferencedBoundsAreDefault() throws LpReadException {
        Model model = read("min", " x + y", "st", " c1: x + y >= 1", "end");

        assertThat(model.variables()).allSatisfy(v -> {
            assertThat(v.lowerBound()).isEqualTo(0.0);
            assertThat(v.upperBound()).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(v.type()).isEqualTo(VariableType.CONTINUOUS);
        });
    }

    @Test
    void testVariableIdentityAcrossSections() throws LpReadException {
        Model model = read("min", " x", "st", " c1: 2 x >= 1", "bounds", " x <= 4", "general", " x",
                "sos", " s1: S1:: x:1");

        assertThat(model.variableCount()).isEqualTo(1);
        assertThat(model.objective().linearTerms().get(0).variable()).isEqualTo(0);
        assertThat(model.constraints().get(0).expression().linearTerms().get(0).variable()).isEqualTo(0);
        assertThat(model.specialOrderedSets().get(0).entries()).containsExactly(new SosEntry(0, 1.0));
        assertThat(model.variable(0)).isEqualTo(new Variable("x", 0.0, 4.0, VariableType.GENERAL));
    }

    @Test
    void testConstraintRoundTrip() throws LpReadException {
        Model model = read("min", " x1", "st", " 3 x1 + 4 x2 <= 12");

        Constraint constraint = model.constraints().get(0);
        assertThat(constraint.lowerBound()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(constraint.upperBound()).isEqualTo(12.0);
        assertThat(constraint.expression().linearTerms()).containsExactly(new LinearTerm(3.0, 0), new LinearTerm(4.0, 1));
    }

    @Test
    void testDoubleBoundEqualsSeparateBounds() throws LpReadException {
        Model combined = read("bounds", " 3 <= x <= 7");
        Model separate = read("bounds", " x >= 3", " y <= 1", " x <= 7");

        assertThat(variable(separate, "x")).isEqualTo(variable(combined, "x"));
    }

    @Test
    void testQuadraticBlockInObjectiveAndConstraint() throws LpReadException {
        Model model = read("min", " [ x ^ 2 ] / 2", "st", " q: [ x ^ 2 ] <= 4");

        assertThat(model.objective().quadraticTerms()).containsExactly(new QuadraticTerm(1.0, 0, 0));
        assertThat(model.constraints().get(0).expression().quadraticTerms()).containsExactly(new QuadraticTerm(1.0, 0, 0));
        assertThat(failure("min", " x", "st", " q: [ x ^ 2 ] / 2 <= 4").getErrorCode())
                .isEqualTo(LpErrorCode.MALFORMED_EXPRESSION);
    }

    @Test
    void testBinaryOverridesEarlierBounds() throws LpReadException {
        Model model = read("bounds", " 2 <= z <= 5", "binary", " z");

        assertThat(variable(model, "z")).isEqualTo(new Variable("z", 0.0, 1.0, VariableType.BINARY));
    }

    @Test
    void testSpecialOrderedSet() throws LpReadException {
        Model model = read("min", " x1", "sos", " setA: S1:: x1:1 x2:2");

        SpecialOrderedSet set = model.specialOrderedSets().get(0);
        assertThat(set.name()).isEqualTo("setA");
        assertThat(set.type()).isEqualTo(1);
        assertThat(set.entries()).extracting(e -> model.variable(e.variable()).name()).containsExactly("x1", "x2");
        assertThat(set.entries()).extracting(SosEntry::weight).containsExactly(1.0, 2.0);
    }

    @Test
    void testAdjacentTermsAreRejected() {
        LpReadException e = failure("min", " x1", "st", " c1: x1 3*x2 <= 4");

        assertThat(e.getErrorCode()).isEqualTo(LpErrorCode.MALFORMED_EXPRESSION);
        assertThat(e.getSourceInfo().lineNumber()).isEqualTo(4);
    }

    @Test
    void testEmptyInput() throws LpReadException {
        Model model = read();

        assertThat(model.sense()).isEqualTo(ObjectiveSense.MINIMIZE);
        assertThat(model.objective().linearTerms()).isEmpty();
        assertThat(model.variableCount()).isZero();
        assertThat(model.constraintCount()).isZero();
    }

    @Test
    void testContentOutsideSections() {
        assertThat(failure("x + y", "min", " x").getErrorCode()).isEqualTo(LpErrorCode.UNEXPECTED_TOKEN);
        assertThat(failure("min", " x", "end", "y").getErrorCode()).isEqualTo(LpErrorCode.UNEXPECTED_TOKEN);
    }

    @Test
    void testDuplicateSectionFile() throws Exception {
        LpReadException e = catchThrowableOfType(() -> reader.read(resource("duplicate-section.lp")), LpReadException.class);

        assertThat(e.getErrorCode()).isEqualTo(LpErrorCode.DUPLICATE_SECTION);
        assertThat(e.getSourceInfo().lineNumber()).isEqualTo(5);
    }

    @Test
    void testMinimizeAndMaximize() {
        assertThat(failure("max", " x", "min", " y").getErrorCode()).isEqualTo(LpErrorCode.DUPLICATE_SECTION);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*TokenClassifier", messagePattern = ".*unterminated-comment.lp:5 is not terminated.*")
    void testUnterminatedCommentIsTolerated() throws Exception {
        Model model = reader.read(resource("unterminated-comment.lp"));

        assertThat(model.constraintCount()).isEqualTo(1);
        assertThat(variable(model, "x").upperBound()).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void testUnterminatedCommentCanBeFatal() throws Exception {
        LpReader strict = new LpReader(ReaderOptions.defaults().withFailOnUnterminatedComment(true));
        Path file = resource("unterminated-comment.lp");

        LpReadException e = catchThrowableOfType(() -> strict.read(file), LpReadException.class);

        assertThat(e.getErrorCode()).isEqualTo(LpErrorCode.UNEXPECTED_END_OF_SECTION);
    }

    @Test
    void testSemiContinuousWithoutGeneral() throws LpReadException {
        Model model = read("min", " s", "semi-continuous", " s");

        assertThat(variable(model, "s").type()).isEqualTo(VariableType.SEMICONTINUOUS);
    }

    @Test
    void testGeneralAndSemiContinuous() throws LpReadException {
        Model model = read("semis", " s", "generals", " s");

        assertThat(variable(model, "s").type()).isEqualTo(VariableType.SEMIINTEGER);
    }

    @Test
    void testMissingFile() {
        LpReadException e = catchThrowableOfType(() -> reader.read(tempDir.resolve("missing.lp")), LpReadException.class);

        assertThat(e.getErrorCode()).isEqualTo(LpErrorCode.UNOPENABLE_INPUT);
    }

    @Test
    void testReadsGzipFile() throws Exception {
        Path gz = compress(resource("production.lp"), new GzipCodec());

        Model model = reader.read(gz);

        assertThat(model.variableCount()).isEqualTo(7);
        assertThat(model.constraintCount()).isEqualTo(4);
    }

    @Test
    void testReadsZstdFile() throws Exception {
        Path zst = compress(resource("production.lp"), new ZstdCodec());

        Model model = reader.read(zst);

        assertThat(model.specialOrderedSets()).hasSize(2);
    }

    @Test
    void testCompressedInputWithCodecNone() throws Exception {
        Path gz = compress(resource("production.lp"), new GzipCodec());
        LpReader plain = new LpReader(ReaderOptions.defaults().withCodec("none"));

        LpReadException e = catchThrowableOfType(() -> plain.read(gz), LpReadException.class);

        assertThat(e.getErrorCode()).isEqualTo(LpErrorCode.UNEXPECTED_CHARACTER);
    }

    @Test
    void testReadsStream() throws LpReadException {
        InputStream in = new ByteArrayInputStream("max\n 2 a + b\nst\n a + b <= 3\n".getBytes(StandardCharsets.UTF_8));

        Model model = reader.read(in, "stream");

        assertThat(model.sense()).isEqualTo(ObjectiveSense.MAXIMIZE);
        assertThat(model.constraints().get(0).upperBound()).isEqualTo(3.0);
    }

    @Test
    void testNonUtf8InputIsRejected() {
        byte[] latin1 = "min\n caf\u00e9 + caf\u00e8\nend\n".getBytes(StandardCharsets.ISO_8859_1);

        LpReadException e = catchThrowableOfType(
                () -> reader.read(new ByteArrayInputStream(latin1), "latin1.lp"), LpReadException.class);

        assertThat(e.getErrorCode()).isEqualTo(LpErrorCode.UNEXPECTED_CHARACTER);
        assertThat(e.getMessage()).contains("UTF-8").contains("latin1.lp");
    }

    @Test
    void testNonAsciiNamesStayDistinct() throws LpReadException {
        byte[] utf8 = "min\n caf\u00e9 + caf\u00e8\nend\n".getBytes(StandardCharsets.UTF_8);

        Model model = reader.read(new ByteArrayInputStream(utf8), "utf8.lp");

        assertThat(model.variables()).extracting(Variable::name).containsExactly("caf\u00e9", "caf\u00e8");
        assertThat(model.objective().linearTerms()).extracting(LinearTerm::variable).containsExactly(0, 1);
    }

    @Test
    void testCallerStreamStaysOpen() throws Exception {
        TrackingInputStream plain = new TrackingInputStream("min\n x\n".getBytes(StandardCharsets.UTF_8));
        reader.read(plain, "plain");
        assertThat(plain.closed).isFalse();

        TrackingInputStream gz = new TrackingInputStream(Files.readAllBytes(compress(resource("production.lp"), new GzipCodec())));
        reader.read(gz, "gz");
        assertThat(gz.closed).isFalse();

        TrackingInputStream broken = new TrackingInputStream("min\n x <\n".getBytes(StandardCharsets.UTF_8));
        catchThrowableOfType(() -> reader.read(broken, "broken"), LpReadException.class);
        assertThat(broken.closed).isFalse();
    }

    private static final class TrackingInputStream extends ByteArrayInputStream {
        private boolean closed;

        TrackingInputStream(byte[] bytes) {
            super(bytes);
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    @Test
    void testReaderIsReusable() throws LpReadException {
        read("min", " a + b");
        Model second = read("min", " c");

        assertThat(second.variables()).extracting(Variable::name).containsExactly("c");
    }
}
