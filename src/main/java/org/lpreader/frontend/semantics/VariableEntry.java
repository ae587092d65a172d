package org.lpreader.frontend.semantics;

import org.lpreader.model.Variable;
import org.lpreader.model.VariableType;

/**
 * The mutable state of a variable while sections refine its bounds and type.
 * Entries are owned by the {@link SymbolTable} and frozen into {@link Variable}s
 * once reading is complete.
 */
public final class VariableEntry {

    private final int handle;
    private final String name;
    private double lowerBound = 0.0;
    private double upperBound = Double.POSITIVE_INFINITY;
    private VariableType type = VariableType.CONTINUOUS;

    VariableEntry(int handle, String name) {
        this.handle = handle;
        this.name = name;
    }

    public int handle() { return handle; }
    public String name() { return name; }
    public double lowerBound() { return lowerBound; }
    public double upperBound() { return upperBound; }
    public VariableType type() { return type; }

    public void setLowerBound(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public void setUpperBound(double upperBound) {
        this.upperBound = upperBound;
    }

    public void setBounds(double lowerBound, double upperBound) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public void setType(VariableType type) {
        this.type = type;
    }

    Variable freeze() {
        return new Variable(name, lowerBound, upperBound, type);
    }
}
