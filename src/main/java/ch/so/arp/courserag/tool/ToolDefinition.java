package ch.so.arp.courserag.tool;

import java.util.Map;
import java.util.Objects;

/**
 * Schema descriptor handed to the language model. {@code inputSchema} is a JSON
 * schema object listing the parameters and which of them are required.
 */
public record ToolDefinition(String name, String description, Map<String, Object> inputSchema) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        inputSchema = Map.copyOf(inputSchema);
    }
}
