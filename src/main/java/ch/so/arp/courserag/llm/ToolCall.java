package ch.so.arp.courserag.llm;

import java.util.Map;

/**
 * Tool invocation requested by the model.
 */
public record ToolCall(String id, String toolName, Map<String, Object> arguments) {
}
