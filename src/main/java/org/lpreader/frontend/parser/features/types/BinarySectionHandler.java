package org.lpreader.frontend.parser.features.types;

import org.lpreader.frontend.semantics.VariableEntry;
import org.lpreader.model.VariableType;

/**
 * Handles the <code>binary</code> section: each listed variable becomes binary with bounds [0, 1].
 */
public class BinarySectionHandler extends AbstractTypeSectionHandler {

    @Override
    protected void apply(VariableEntry variable) {
        variable.setType(VariableType.BINARY);
        variable.setBounds(0.0, 1.0);
    }
}
