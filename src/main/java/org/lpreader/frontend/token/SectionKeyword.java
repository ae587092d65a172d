package org.lpreader.frontend.token;

/**
 * The sections an LP file can contain.
 */
public enum SectionKeyword {
    /** Pseudo-section for tokens before the first section keyword. */
    NONE,
    MINIMIZE,
    MAXIMIZE,
    CONSTRAINTS,
    BOUNDS,
    GENERAL,
    BINARY,
    SEMICONTINUOUS,
    SOS,
    END
}
