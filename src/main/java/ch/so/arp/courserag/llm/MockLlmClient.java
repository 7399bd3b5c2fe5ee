package ch.so.arp.courserag.llm;

import java.util.List;
import java.util.Map;

import ch.so.arp.courserag.tool.ToolDefinition;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * Anthropic API should not be contacted. When tools are offered it asks for the
 * first one with the question as query, then answers with the tool output.
 */
public class MockLlmClient implements LlmClient {

    static final String TOOL_CALL_ID = "mock-tool-call";

    @Override
    public LlmResponse complete(LlmRequest request) {
        ChatMessage last = request.messages().get(request.messages().size() - 1);
        List<ContentBlock.ToolResult> toolResults = last.content().stream()
                .filter(ContentBlock.ToolResult.class::isInstance)
                .map(ContentBlock.ToolResult.class::cast)
                .toList();
        if (!toolResults.isEmpty()) {
            StringBuilder answer = new StringBuilder("[mocked answer] Based on the course materials:");
            toolResults.forEach(result -> answer.append("\n\n").append(result.content()));
            return new LlmResponse.FinalText(answer.toString());
        }

        String question = textOf(last);
        if (request.offersTools()) {
            ToolDefinition tool = request.tools().get(0);
            String argument = tool.inputSchema().get("required") instanceof List<?> required && !required.isEmpty()
                    ? required.get(0).toString()
                    : "query";
            return LlmResponse.ToolUseRequested.of(List.of(
                    new ContentBlock.ToolUse(TOOL_CALL_ID, tool.name(), Map.of(argument, question))));
        }
        return new LlmResponse.FinalText("[mocked answer] Provide an API key to reach the real model. Question was: "
                + question);
    }

    private static String textOf(ChatMessage message) {
        StringBuilder text = new StringBuilder();
        for (ContentBlock block : message.content()) {
            if (block instanceof ContentBlock.Text part) {
                text.append(part.text());
            }
        }
        return text.toString();
    }
}
