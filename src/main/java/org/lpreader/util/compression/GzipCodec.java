package org.lpreader.util.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip codec backed by {@code java.util.zip}. Multi-member streams are read as one.
 */
public class GzipCodec implements ICompressionCodec {

    private static final byte[] MAGIC = {(byte) 0x1f, (byte) 0x8b};

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new GZIPOutputStream(out);
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new GZIPInputStream(in);
    }

    @Override
    public String getName() {
        return "gzip";
    }

    @Override
    public String getFileExtension() {
        return ".gz";
    }

    @Override
    public boolean matches(byte[] header) {
        return CompressionCodecFactory.startsWith(header, MAGIC);
    }

    @Override
    public void validateEnvironment() {
        // Part of the JDK.
    }

    @Override
    public String toString() {
        return "GzipCodec{name='gzip'}";
    }
}
