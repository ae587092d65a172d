package org.lpreader.model;

/**
 * One member of a special ordered set.
 *
 * @param variable The handle of the variable.
 * @param weight The weight that orders the member within the set.
 */
public record SosEntry(int variable, double weight) {
}
