package org.lpreader.api;

import org.lpreader.model.Model;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface for reading LP files.
 * <p>
 * Every read either returns a fully valid, immutable {@link Model} or throws an
 * {@link LpReadException}. There is no partial result.
 */
public interface ILpReader {

    /**
     * Reads a model from a file. Compressed files are decompressed transparently.
     *
     * @param file The path of the LP file.
     * @return The parsed model.
     * @throws LpReadException if the file cannot be opened or is malformed.
     */
    Model read(Path file) throws LpReadException;

    /**
     * Reads a model from a byte stream positioned at the start of an LP text.
     * The stream is consumed completely but not closed.
     *
     * @param in The input stream.
     * @param sourceName A name for the input, used in error messages.
     * @return The parsed model.
     * @throws LpReadException if the input is malformed or cannot be read.
     */
    Model read(InputStream in, String sourceName) throws LpReadException;

    /**
     * Reads a model from lines already held in memory.
     *
     * @param lines The lines of the LP text.
     * @param sourceName A name for the input, used in error messages.
     * @return The parsed model.
     * @throws LpReadException if the input is malformed.
     */
    Model read(List<String> lines, String sourceName) throws LpReadException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (e.g., 0=quiet, 1=normal, 2=verbose, 3=trace).
     */
    void setVerbosity(int level);
}
