package org.lpreader.util.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A compression format an LP file may be stored in.
 * <p>
 * The reader picks a codec by name or by sniffing the magic number of the input
 * (see {@link CompressionCodecFactory#select(String, InputStream)}) and reads the
 * model text through {@link #wrapInputStream(InputStream)}.
 */
public interface ICompressionCodec {

    /**
     * Wraps a sink so that written model text is compressed.
     * Closing the returned stream writes the trailer of the format.
     *
     * @param out the sink receiving compressed bytes
     * @return the compressing stream
     * @throws IOException if the stream cannot be created
     */
    OutputStream wrapOutputStream(OutputStream out) throws IOException;

    /**
     * Wraps a compressed source.
     *
     * @param in the compressed bytes
     * @return the decompressed model text
     * @throws IOException if the format header is invalid
     */
    InputStream wrapInputStream(InputStream in) throws IOException;

    /**
     * @return the name accepted by {@code lpreader.decompression.codec} and {@code --codec}
     */
    String getName();

    /**
     * @return the usual file suffix, e.g. {@code ".gz"}, or an empty string
     */
    String getFileExtension();

    /**
     * @param header up to the first four bytes of the input
     * @return whether the input starts with this format's magic number
     */
    boolean matches(byte[] header);

    /**
     * Checks that the codec can run here, e.g. that a native library loads.
     *
     * @throws CompressionException if the codec is unusable on this platform
     */
    void validateEnvironment() throws CompressionException;
}
