package org.lpreader.api;

/**
 * A pure data class representing a position in the input.
 *
 * @param sourceName The name of the input, usually its file path.
 * @param lineNumber The 1-based physical line number.
 */
public record SourceInfo(String sourceName, int lineNumber) {

    @Override
    public String toString() {
        return sourceName + ":" + lineNumber;
    }
}
