package ch.so.arp.courserag.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.courserag.retrieval.Source;

/**
 * Registry of the tools offered to the language model. Invocation never throws:
 * unknown tools and failing tools are reported as text so that the dialogue can
 * continue.
 */
public class ToolRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private List<Source> lastSources = List.of();

    /**
     * Register a tool. A tool with the same name replaces the earlier one.
     */
    public void register(Tool tool) {
        ToolDefinition definition = tool.definition();
        if (tools.put(definition.name(), tool) != null) {
            LOGGER.warn("Replaced previously registered tool '{}'", definition.name());
        }
    }

    /**
     * Definitions of all registered tools in registration order.
     */
    public List<ToolDefinition> definitions() {
        return tools.values().stream().map(Tool::definition).toList();
    }

    public ToolResult invoke(String name, Map<String, Object> arguments) {
        Tool tool = tools.get(name);
        if (tool == null) {
            LOGGER.warn("Model requested unknown tool '{}'", name);
            return ToolResult.plain("Tool '" + name + "' not found");
        }
        ToolResult result;
        try {
            result = tool.execute(arguments == null ? Map.of() : arguments);
        } catch (RuntimeException ex) {
            LOGGER.warn("Tool '{}' failed with arguments {}: {}", name, arguments, ex.getMessage(), ex);
            return ToolResult.plain("Tool '" + name + "' failed: " + ex.getMessage());
        }
        if (result.carriesSources()) {
            lastSources = result.sources();
        }
        LOGGER.debug("Tool '{}' returned {} characters and {} sources", name, result.text().length(),
                result.sources().size());
        return result;
    }

    /**
     * Sources of the most recent retrieval performed through this registry.
     */
    public List<Source> lastSources() {
        return lastSources;
    }

    public void resetSources() {
        lastSources = List.of();
    }
}
