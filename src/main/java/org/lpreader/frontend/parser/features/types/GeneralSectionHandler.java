package org.lpreader.frontend.parser.features.types;

import org.lpreader.frontend.semantics.VariableEntry;
import org.lpreader.model.VariableType;

/**
 * Handles the <code>general</code> section. A variable that is already
 * semicontinuous becomes semi-integer.
 */
public class GeneralSectionHandler extends AbstractTypeSectionHandler {

    @Override
    protected void apply(VariableEntry variable) {
        variable.setType(variable.type() == VariableType.SEMICONTINUOUS
                ? VariableType.SEMIINTEGER
                : VariableType.GENERAL);
    }
}
