package org.lpreader.frontend.sections;

import org.lpreader.frontend.parser.features.bounds.BoundsSectionHandler;
import org.lpreader.frontend.parser.features.constraints.ConstraintSectionHandler;
import org.lpreader.frontend.parser.features.end.EndSectionHandler;
import org.lpreader.frontend.parser.features.objective.ObjectiveSectionHandler;
import org.lpreader.frontend.parser.features.sos.SosSectionHandler;
import org.lpreader.frontend.parser.features.types.BinarySectionHandler;
import org.lpreader.frontend.parser.features.types.GeneralSectionHandler;
import org.lpreader.frontend.parser.features.types.SemiContinuousSectionHandler;
import org.lpreader.frontend.token.SectionKeyword;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A registry for section handlers. Handlers are kept in the declaration order of
 * {@link SectionKeyword}, which is also the order sections are processed in:
 * the objective before the constraints, bounds before the type sections, so
 * that a binary declaration overrides an earlier bound.
 */
public class SectionHandlerRegistry {
    private final Map<SectionKeyword, ISectionHandler> handlers = new EnumMap<>(SectionKeyword.class);

    /**
     * Registers a new section handler.
     * @param keyword The section keyword.
     * @param handler The handler for the section.
     */
    public void register(SectionKeyword keyword, ISectionHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * @return All registered handlers in processing order.
     */
    public Map<SectionKeyword, ISectionHandler> entries() {
        return Collections.unmodifiableMap(handlers);
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link SectionHandlerRegistry} with all handlers registered.
     */
    public static SectionHandlerRegistry initialize() {
        SectionHandlerRegistry registry = new SectionHandlerRegistry();
        EndSectionHandler endHandler = new EndSectionHandler();
        registry.register(SectionKeyword.NONE, endHandler);

        ObjectiveSectionHandler objectiveHandler = new ObjectiveSectionHandler();
        registry.register(SectionKeyword.MINIMIZE, objectiveHandler);
        registry.register(SectionKeyword.MAXIMIZE, objectiveHandler);

        registry.register(SectionKeyword.CONSTRAINTS, new ConstraintSectionHandler());
        registry.register(SectionKeyword.BOUNDS, new BoundsSectionHandler());
        registry.register(SectionKeyword.GENERAL, new GeneralSectionHandler());
        registry.register(SectionKeyword.BINARY, new BinarySectionHandler());
        registry.register(SectionKeyword.SEMICONTINUOUS, new SemiContinuousSectionHandler());
        registry.register(SectionKeyword.SOS, new SosSectionHandler());
        registry.register(SectionKeyword.END, endHandler);
        return registry;
    }
}
