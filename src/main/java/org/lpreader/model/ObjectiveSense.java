package org.lpreader.model;

/**
 * The direction of optimization.
 */
public enum ObjectiveSense {
    /** Minimize the objective. Also the sense of a model without objective section. */
    MINIMIZE,
    /** Maximize the objective. */
    MAXIMIZE
}
