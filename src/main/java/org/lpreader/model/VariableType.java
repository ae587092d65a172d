package org.lpreader.model;

/**
 * The domain of a variable.
 */
public enum VariableType {
    /** Any real value within the bounds. */
    CONTINUOUS,
    /** Either 0 or 1. */
    BINARY,
    /** Any integer value within the bounds. */
    GENERAL,
    /** Either 0 or a real value within the bounds. */
    SEMICONTINUOUS,
    /** Either 0 or an integer value within the bounds. */
    SEMIINTEGER
}
