package org.lpreader.model;

import java.util.List;

/**
 * A special ordered set constraint.
 * Type 1 allows at most one nonzero member, type 2 at most two adjacent ones.
 *
 * @param name The name of the set.
 * @param type 1 or 2.
 * @param entries The members in file order.
 */
public record SpecialOrderedSet(String name, int type, List<SosEntry> entries) {

    public SpecialOrderedSet {
        if (type != 1 && type != 2) {
            throw new IllegalArgumentException("SOS type must be 1 or 2, got " + type);
        }
        entries = List.copyOf(entries);
    }
}
