package org.lpreader.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * The settings of the reader, taken from the {@code lpreader} block of the configuration.
 * <pre>
 * lpreader {
 *   verbosity = 2
 *   decompression.codec = "auto"   # auto | none | gzip | zstd
 *   comments.fail-on-unterminated = false
 *   compatibility.legacy-semi-section-guard = false
 * }
 * </pre>
 *
 * @param verbosity The log verbosity of {@link org.lpreader.diagnostics.ReaderLogger}.
 * @param codec The decompression codec name.
 * @param failOnUnterminatedComment Whether an unterminated block comment is fatal.
 * @param legacySemiSectionGuard Whether the semicontinuous section is only processed when
 *                               an integer section exists, as older readers did.
 */
public record ReaderOptions(
        int verbosity,
        String codec,
        boolean failOnUnterminatedComment,
        boolean legacySemiSectionGuard
) {

    private static final String ROOT = "lpreader";

    /**
     * @return The options from the classpath {@code reference.conf}.
     */
    public static ReaderOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads the options from a configuration. Missing keys fall back to the built-in defaults.
     * @param config The full application configuration.
     * @return The options.
     */
    public static ReaderOptions fromConfig(Config config) {
        Config reader = config.hasPath(ROOT)
                ? config.getConfig(ROOT).withFallback(ConfigFactory.defaultReference().getConfig(ROOT))
                : ConfigFactory.defaultReference().getConfig(ROOT);
        return new ReaderOptions(
                reader.getInt("verbosity"),
                reader.getString("decompression.codec"),
                reader.getBoolean("comments.fail-on-unterminated"),
                reader.getBoolean("compatibility.legacy-semi-section-guard")
        );
    }

    public ReaderOptions withCodec(String codec) {
        return new ReaderOptions(verbosity, codec, failOnUnterminatedComment, legacySemiSectionGuard);
    }

    public ReaderOptions withFailOnUnterminatedComment(boolean fail) {
        return new ReaderOptions(verbosity, codec, fail, legacySemiSectionGuard);
    }

    public ReaderOptions withLegacySemiSectionGuard(boolean legacy) {
        return new ReaderOptions(verbosity, codec, failOnUnterminatedComment, legacy);
    }
}
