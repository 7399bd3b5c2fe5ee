package ch.so.arp.courserag.llm;

import java.util.List;

import ch.so.arp.courserag.tool.ToolDefinition;

/**
 * One call to the language model. An empty tool list means the model must
 * answer with text.
 */
public record LlmRequest(String system, List<ChatMessage> messages, List<ToolDefinition> tools) {

    public LlmRequest {
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public boolean offersTools() {
        return !tools.isEmpty();
    }
}
