package org.lpreader.frontend.semantics;

import org.lpreader.model.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every variable of a read. Variables are created lazily on their first
 * reference and identified by a stable integer handle, their creation index.
 * Names are case-sensitive.
 */
public class SymbolTable {

    private final List<VariableEntry> entries = new ArrayList<>();
    private final Map<String, VariableEntry> byName = new HashMap<>();

    /**
     * Returns the variable with the given name, creating it with bounds [0, +inf)
     * and type continuous if it has not been referenced before.
     * @param name The variable name.
     * @return The one entry for this name.
     */
    public VariableEntry resolveVariable(String name) {
        return byName.computeIfAbsent(name, n -> {
            VariableEntry entry = new VariableEntry(entries.size(), n);
            entries.add(entry);
            return entry;
        });
    }

    /**
     * Looks up a variable without creating it.
     * @param name The variable name.
     * @return The entry, or empty if the name was never referenced.
     */
    public Optional<VariableEntry> lookup(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return Immutable snapshots of all variables in first-reference order.
     */
    public List<Variable> freeze() {
        List<Variable> variables = new ArrayList<>(entries.size());
        for (VariableEntry entry : entries) {
            variables.add(entry.freeze());
        }
        return variables;
    }
}
