package org.lpreader.frontend.semantics;

import org.lpreader.model.Constraint;
import org.lpreader.model.Expression;
import org.lpreader.model.Model;
import org.lpreader.model.ObjectiveSense;
import org.lpreader.model.SpecialOrderedSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the parts of a model while the section handlers run and assembles
 * the immutable {@link Model} at the end. Not thread-safe; one builder per read.
 */
public class ModelBuilder {

    private final SymbolTable symbolTable = new SymbolTable();
    private final List<Constraint> constraints = new ArrayList<>();
    private final List<SpecialOrderedSet> specialOrderedSets = new ArrayList<>();
    private ObjectiveSense sense = ObjectiveSense.MINIMIZE;
    private Expression objective = Expression.empty();

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public void setObjective(ObjectiveSense sense, Expression objective) {
        this.sense = sense;
        this.objective = objective;
    }

    public void addConstraint(Constraint constraint) {
        constraints.add(constraint);
    }

    public void addSpecialOrderedSet(SpecialOrderedSet set) {
        specialOrderedSets.add(set);
    }

    /**
     * @return The model as collected so far.
     */
    public Model build() {
        return new Model(sense, objective, constraints, symbolTable.freeze(), specialOrderedSets);
    }
}
