package ch.so.arp.courserag.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Part of a chat message exchanged with the language model.
 */
public sealed interface ContentBlock permits ContentBlock.Text, ContentBlock.ToolUse, ContentBlock.ToolResult {

    record Text(String text) implements ContentBlock {

        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Request of the model to run a tool; {@code id} links it to the result.
     */
    record ToolUse(String id, String name, Map<String, Object> input) implements ContentBlock {

        public ToolUse {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
            input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        }
    }

    record ToolResult(String toolUseId, String content) implements ContentBlock {

        public ToolResult {
            Objects.requireNonNull(toolUseId, "toolUseId");
            Objects.requireNonNull(content, "content");
        }
    }
}
