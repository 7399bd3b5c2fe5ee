package ch.so.arp.courserag.llm;

import java.util.List;

/**
 * Answer of the language model: either final text or a request to run tools.
 */
public sealed interface LlmResponse permits LlmResponse.FinalText, LlmResponse.ToolUseRequested {

    record FinalText(String text) implements LlmResponse {
    }

    /**
     * @param content the raw assistant content, replayed verbatim in the follow-up
     *                request
     * @param calls   the tool calls contained in {@code content}, in order
     */
    record ToolUseRequested(List<ContentBlock> content, List<ToolCall> calls) implements LlmResponse {

        public ToolUseRequested {
            content = List.copyOf(content);
            calls = List.copyOf(calls);
        }

        public static ToolUseRequested of(List<ContentBlock> content) {
            List<ToolCall> calls = content.stream()
                    .filter(ContentBlock.ToolUse.class::isInstance)
                    .map(ContentBlock.ToolUse.class::cast)
                    .map(block -> new ToolCall(block.id(), block.name(), block.input()))
                    .toList();
            return new ToolUseRequested(content, calls);
        }
    }
}
