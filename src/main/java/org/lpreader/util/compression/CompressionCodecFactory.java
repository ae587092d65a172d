package org.lpreader.util.compression;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Factory for compression codecs.
 * <p>
 * Codecs are selected by the name configured under {@code lpreader.decompression.codec}:
 * <ul>
 *   <li>"none" → {@link NoneCodec}</li>
 *   <li>"gzip" → {@link GzipCodec}</li>
 *   <li>"zstd" → {@link ZstdCodec}</li>
 *   <li>"auto" → chosen per stream by {@link #detect(InputStream)}</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> This factory is stateless and thread-safe.
 */
public class CompressionCodecFactory {

    /** The codec name that selects detection by magic number. */
    public static final String AUTO = "auto";

    private static final int HEADER_LENGTH = 4;

    /**
     * Creates a codec by name.
     *
     * @param codecName one of "none", "gzip" or "zstd", case-insensitive
     * @return the codec
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ICompressionCodec create(String codecName) {
        String name = codecName.toLowerCase(Locale.ROOT);
        return switch (name) {
            case "none" -> new NoneCodec();
            case "gzip" -> new GzipCodec();
            case "zstd" -> new ZstdCodec();
            default -> throw new IllegalArgumentException(
                "Unknown compression codec: '" + codecName + "'. " +
                "Supported codecs: 'auto', 'none', 'gzip', 'zstd'"
            );
        };
    }

    /**
     * Selects the codec for a stream, either by name or by detection.
     *
     * @param codecName a codec name or {@value #AUTO}
     * @param in the stream; must support mark/reset if {@code codecName} is {@value #AUTO}
     * @return a validated codec
     * @throws IOException if the stream header cannot be read
     * @throws CompressionException if the codec cannot be used in this environment
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ICompressionCodec select(String codecName, InputStream in) throws IOException, CompressionException {
        ICompressionCodec codec = AUTO.equalsIgnoreCase(codecName) ? detect(in) : create(codecName);
        codec.validateEnvironment();
        return codec;
    }

    /**
     * Detects the codec of a stream from its magic number without consuming any bytes.
     * Streams with an unknown header are treated as uncompressed.
     *
     * @param in a stream supporting mark/reset
     * @return the matching codec, {@link NoneCodec} if none matches
     * @throws IOException if the header cannot be read
     */
    public static ICompressionCodec detect(InputStream in) throws IOException {
        if (!in.markSupported()) {
            throw new IllegalArgumentException("Codec detection requires a stream that supports mark/reset");
        }
        in.mark(HEADER_LENGTH);
        byte[] header;
        try {
            header = in.readNBytes(HEADER_LENGTH);
        } finally {
            in.reset();
        }
        for (ICompressionCodec codec : List.of(new GzipCodec(), new ZstdCodec())) {
            if (codec.matches(header)) {
                return codec;
            }
        }
        return new NoneCodec();
    }

    static boolean startsWith(byte[] header, byte[] magic) {
        if (header.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (header[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    private CompressionCodecFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
