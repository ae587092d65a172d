package org.lpreader.model;

import java.util.List;
import java.util.Optional;

/**
 * The immutable result of reading an LP file.
 * <p>
 * Terms and SOS entries refer to variables by handle, which is the index of the
 * variable in {@link #variables()}. Variables appear in the order of their first
 * reference, with sections visited in processing order (objective, constraints,
 * bounds, type sections, special ordered sets).
 *
 * @param sense The objective sense.
 * @param objective The objective expression, empty if the file has no objective section.
 * @param constraints The constraints in file order.
 * @param variables The variables in first-reference order.
 * @param specialOrderedSets The SOS constraints in file order.
 */
public record Model(
        ObjectiveSense sense,
        Expression objective,
        List<Constraint> constraints,
        List<Variable> variables,
        List<SpecialOrderedSet> specialOrderedSets
) {

    public Model {
        constraints = List.copyOf(constraints);
        variables = List.copyOf(variables);
        specialOrderedSets = List.copyOf(specialOrderedSets);
    }

    /**
     * Resolves a variable handle.
     * @param handle The handle stored in a term or SOS entry.
     * @return The variable.
     */
    public Variable variable(int handle) {
        return variables.get(handle);
    }

    /**
     * Looks up a variable by its exact name.
     * @param name The variable name.
     * @return The variable, or empty if the file never mentions it.
     */
    public Optional<Variable> findVariable(String name) {
        return variables.stream().filter(v -> v.name().equals(name)).findFirst();
    }

    public int variableCount() {
        return variables.size();
    }

    public int constraintCount() {
        return constraints.size();
    }
}
