package com.defiguard.tool;

import com.defiguard.exception.ConfigurationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Startup-validated mapping from {@link ToolName} to its handler.
 *
 * <p>Construction fails if two handlers claim the same tool or if any tool in the
 * closed set has no handler, so a misconfigured deployment never starts serving.
 * Lookups by wire name return empty for anything outside the closed set.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<ToolName, ToolHandler<?>> handlers;

    public ToolRegistry(List<ToolHandler<?>> toolHandlers) {
        Map<ToolName, ToolHandler<?>> registered = new EnumMap<>(ToolName.class);
        for (ToolHandler<?> handler : toolHandlers) {
            ToolHandler<?> previous = registered.putIfAbsent(handler.toolName(), handler);
            if (previous != null) {
                throw new ConfigurationException("Duplicate handler for tool " + handler.toolName() + ": "
                        + previous.getClass().getSimpleName() + " and "
                        + handler.getClass().getSimpleName());
            }
        }

        Set<ToolName> missing = EnumSet.allOf(ToolName.class);
        missing.removeAll(registered.keySet());
        if (!missing.isEmpty()) {
            throw new ConfigurationException("No handler registered for tools " + missing);
        }

        this.handlers = Collections.unmodifiableMap(registered);
        log.info("Tool registry initialized with {} tools: {}", handlers.size(), handlers.keySet());
    }

    public Optional<ToolHandler<?>> find(String wireName) {
        return ToolName.fromWireName(wireName).map(handlers::get);
    }

    public ToolHandler<?> get(ToolName toolName) {
        return handlers.get(toolName);
    }

    public Set<ToolName> getToolNames() {
        return handlers.keySet();
    }
}
