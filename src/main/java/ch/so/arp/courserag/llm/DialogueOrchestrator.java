package ch.so.arp.courserag.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.courserag.retrieval.Source;
import ch.so.arp.courserag.tool.ToolDefinition;
import ch.so.arp.courserag.tool.ToolRegistry;
import ch.so.arp.courserag.tool.ToolResult;

/**
 * Drives one exchange with the language model. If the model asks for tools, the
 * calls are executed in order, their results are sent back and the model is
 * asked once more, this time without tools, for the final answer.
 */
public class DialogueOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DialogueOrchestrator.class);

    static final String SYSTEM_PROMPT = """
            You are an AI assistant specialized in course materials and educational content with access to \
            tools for course information.

            Tool usage:
            - search_course_content: questions about specific course content or detailed educational materials
            - get_course_outline: questions about a course outline, its link, its instructor or its lesson list. \
            Answer outline questions with the course title, the course link and every lesson number and lesson title
            - One tool call per query maximum
            - Synthesize tool results into accurate, fact-based responses
            - If a tool yields no results, state this clearly without offering alternatives

            Response protocol:
            - General knowledge questions: answer using existing knowledge without using tools
            - Course-specific questions: use the appropriate tool first, then answer
            - No meta-commentary: do not explain your search process or mention the tool results, \
            provide the direct answer only

            All responses must be:
            1. Brief, Concise and focused - get to the point quickly
            2. Educational - maintain instructional value
            3. Clear - use accessible language
            4. Example-supported - include relevant examples when they aid understanding

            Provide only the direct answer to what was asked.""";

    private final LlmClient llmClient;

    public DialogueOrchestrator(LlmClient llmClient) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    }

    /**
     * Answer a query.
     *
     * @param query    the user question
     * @param history  rendered previous exchanges, may be empty
     * @param tools    tools offered to the model, may be empty
     * @param registry executes the tools the model asks for
     * @return the final answer and the sources of the last retrieval
     * @throws LlmClientException if a call to the model fails
     */
    public DialogueResult generate(String query, String history, List<ToolDefinition> tools, ToolRegistry registry) {
        String system = systemPrompt(history);
        ChatMessage question = ChatMessage.user(query);

        LlmResponse first = llmClient.complete(new LlmRequest(system, List.of(question), tools));
        if (first instanceof LlmResponse.FinalText text) {
            return new DialogueResult(text.text(), List.of());
        }

        LlmResponse.ToolUseRequested toolUse = (LlmResponse.ToolUseRequested) first;
        List<ContentBlock.ToolResult> results = new ArrayList<>();
        List<Source> sources = List.of();
        for (ToolCall call : toolUse.calls()) {
            LOGGER.debug("Model requested tool '{}' with {}", call.toolName(), call.arguments());
            ToolResult result = registry.invoke(call.toolName(), call.arguments());
            results.add(new ContentBlock.ToolResult(call.id(), result.text()));
            if (result.carriesSources()) {
                sources = result.sources();
            }
        }

        List<ChatMessage> messages = List.of(
                question,
                ChatMessage.assistant(toolUse.content()),
                ChatMessage.user(results));
        LlmResponse second = llmClient.complete(new LlmRequest(system, messages, List.of()));
        if (second instanceof LlmResponse.FinalText text) {
            return new DialogueResult(text.text(), sources);
        }
        // tools are not offered in the second round; take whatever text came along
        LOGGER.warn("Model asked for tools again after the tool round, ignoring the request");
        return new DialogueResult(textOf(((LlmResponse.ToolUseRequested) second).content()), sources);
    }

    static String systemPrompt(String history) {
        if (history == null || history.isBlank()) {
            return SYSTEM_PROMPT;
        }
        return SYSTEM_PROMPT + "\n\nPrevious conversation:\n" + history;
    }

    private static String textOf(List<ContentBlock> content) {
        StringBuilder text = new StringBuilder();
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.Text part) {
                text.append(part.text());
            }
        }
        return text.toString();
    }
}
