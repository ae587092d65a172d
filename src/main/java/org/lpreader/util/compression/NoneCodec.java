package org.lpreader.util.compression;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Pass-through codec for uncompressed input.
 */
public class NoneCodec implements ICompressionCodec {

    @Override
    public OutputStream wrapOutputStream(OutputStream out) {
        return out;
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        return in;
    }

    @Override
    public String getName() {
        return "none";
    }

    @Override
    public String getFileExtension() {
        return "";
    }

    @Override
    public boolean matches(byte[] header) {
        return true;
    }

    @Override
    public void validateEnvironment() {
        // Nothing to load.
    }

    @Override
    public String toString() {
        return "NoneCodec{name='none'}";
    }
}
