package ch.so.arp.courserag.llm;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ch.so.arp.courserag.tool.ToolDefinition;

class MockLlmClientTest {

    private final MockLlmClient client = new MockLlmClient();

    @Test
    void requestsFirstToolWithQuestionAsRequiredArgument() {
        ToolDefinition search = new ToolDefinition("search_course_content", "search",
                Map.of("type", "object", "required", List.of("query")));

        LlmResponse response = client.complete(new LlmRequest("system", List.of(ChatMessage.user("What is MCP?")),
                List.of(search)));

        assertThat(response).isInstanceOf(LlmResponse.ToolUseRequested.class);
        assertThat(((LlmResponse.ToolUseRequested) response).calls()).containsExactly(
                new ToolCall(MockLlmClient.TOOL_CALL_ID, "search_course_content", Map.of("query", "What is MCP?")));
    }

    @Test
    void answersWithToolOutput() {
        ChatMessage results = ChatMessage.user(List.of(
                new ContentBlock.ToolResult(MockLlmClient.TOOL_CALL_ID, "[MCP - Lesson 1]\ntext")));

        LlmResponse response = client.complete(new LlmRequest("system", List.of(results), List.of()));

        assertThat(response).isEqualTo(new LlmResponse.FinalText(
                "[mocked answer] Based on the course materials:\n\n[MCP - Lesson 1]\ntext"));
    }

    @Test
    void echoesQuestionWithoutTools() {
        LlmResponse response = client.complete(new LlmRequest("system", List.of(ChatMessage.user("Hi")), List.of()));

        assertThat(((LlmResponse.FinalText) response).text()).endsWith("Question was: Hi");
    }
}
