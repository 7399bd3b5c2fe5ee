package ch.so.arp.courserag.llm;

import java.util.List;
import java.util.Objects;

/**
 * Message of the conversation sent to the language model.
 */
public record ChatMessage(Role role, List<ContentBlock> content) {

    public ChatMessage {
        Objects.requireNonNull(role, "role");
        content = List.copyOf(content);
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(Role.USER, List.of(new ContentBlock.Text(text)));
    }

    public static ChatMessage user(List<? extends ContentBlock> content) {
        return new ChatMessage(Role.USER, List.copyOf(content));
    }

    public static ChatMessage assistant(List<ContentBlock> content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }

    public enum Role {
        USER("user"),
        ASSISTANT("assistant");

        private final String wireName;

        Role(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }
}
