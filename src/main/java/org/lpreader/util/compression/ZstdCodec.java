package org.lpreader.util.compression;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Zstandard codec backed by zstd-jni.
 * <p>
 * The native library is not available on every platform (musl-based Linux in particular),
 * so {@link #validateEnvironment()} probes it before a model is read.
 */
public class ZstdCodec implements ICompressionCodec {

    private static final byte[] MAGIC = {(byte) 0x28, (byte) 0xb5, (byte) 0x2f, (byte) 0xfd};
    private static final byte[] PROBE = "minimize\n obj: x\nend\n".getBytes(StandardCharsets.UTF_8);

    private final int level;

    public ZstdCodec() {
        this(3);
    }

    /**
     * @param level compression level used when writing, clamped to 1..22
     */
    public ZstdCodec(int level) {
        this.level = Math.max(1, Math.min(22, level));
    }

    public int getLevel() {
        return level;
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new ZstdOutputStream(out, level);
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new ZstdInputStream(in);
    }

    @Override
    public String getName() {
        return "zstd";
    }

    @Override
    public String getFileExtension() {
        return ".zst";
    }

    @Override
    public boolean matches(byte[] header) {
        return CompressionCodecFactory.startsWith(header, MAGIC);
    }

    @Override
    public void validateEnvironment() throws CompressionException {
        byte[] restored;
        try {
            restored = Zstd.decompress(Zstd.compress(PROBE, level), PROBE.length);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            throw new CompressionException("zstd native library could not be loaded on "
                    + System.getProperty("os.name") + "/" + System.getProperty("os.arch") + ": " + e.getMessage(), e);
        }
        if (!Arrays.equals(PROBE, restored)) {
            throw new CompressionException("zstd native library is loaded but returned corrupt data");
        }
    }

    @Override
    public String toString() {
        return "ZstdCodec{level=" + level + "}";
    }
}
