package ch.so.arp.courserag.llm;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.courserag.tool.ToolDefinition;

/**
 * {@link LlmClient} calling the Anthropic Messages API over the JDK HTTP client.
 * A response with stop reason {@code tool_use} becomes a
 * {@link LlmResponse.ToolUseRequested}, every other response is final text.
 */
public class AnthropicLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnthropicLlmClient.class);

    private static final TypeReference<LinkedHashMap<String, Object>> INPUT_TYPE = new TypeReference<>() {
    };

    private final AnthropicClientProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public AnthropicLlmClient(AnthropicClientProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.anthropic.api-key' or ANTHROPIC_API_KEY must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public LlmResponse complete(LlmRequest request) {
        LOGGER.debug("Calling model {} via base URL {} ({} messages, {} tools)", properties.getModel(),
                properties.getBaseUrl(), request.messages().size(), request.tools().size());
        HttpResponse<String> response;
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(properties.getBaseUrl() + "/messages"))
                    .header("Content-Type", "application/json")
                    .header("x-api-key", properties.getApiKey())
                    .header("anthropic-version", properties.getApiVersion())
                    .timeout(properties.getTimeout())
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(toRequestBody(request))))
                    .build();
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new LlmClientException("Anthropic API call failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LlmClientException("Interrupted while waiting for the Anthropic API", ex);
        }

        LOGGER.debug("Anthropic response status: {}", response.statusCode());
        if (response.statusCode() / 100 != 2) {
            throw new LlmClientException(
                    "Anthropic API error [" + response.statusCode() + "]: " + response.body(), response.statusCode());
        }
        try {
            return fromResponseBody(objectMapper.readTree(response.body()));
        } catch (IOException ex) {
            throw new LlmClientException("Unreadable Anthropic API response: " + ex.getMessage(), ex);
        }
    }

    ObjectNode toRequestBody(LlmRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", properties.getModel());
        body.put("max_tokens", properties.getMaxTokens());
        body.put("temperature", properties.getTemperature());
        body.put("system", request.system());

        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.messages()) {
            ObjectNode node = messages.addObject();
            node.put("role", message.role().wireName());
            ArrayNode content = node.putArray("content");
            message.content().forEach(block -> content.add(toJson(block)));
        }

        if (request.offersTools()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : request.tools()) {
                ObjectNode node = tools.addObject();
                node.put("name", tool.name());
                node.put("description", tool.description());
                node.set("input_schema", objectMapper.valueToTree(tool.inputSchema()));
            }
            body.putObject("tool_choice").put("type", "auto");
        }
        return body;
    }

    LlmResponse fromResponseBody(JsonNode body) {
        List<ContentBlock> content = new ArrayList<>();
        for (JsonNode block : body.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                content.add(new ContentBlock.Text(block.path("text").asText()));
            } else if ("tool_use".equals(type)) {
                Map<String, Object> input = objectMapper.convertValue(block.path("input"), INPUT_TYPE);
                content.add(new ContentBlock.ToolUse(block.path("id").asText(), block.path("name").asText(), input));
            } else {
                LOGGER.debug("Ignoring content block of type '{}'", type);
            }
        }

        if ("tool_use".equals(body.path("stop_reason").asText())) {
            return LlmResponse.ToolUseRequested.of(content);
        }
        StringBuilder text = new StringBuilder();
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.Text part) {
                text.append(part.text());
            }
        }
        return new LlmResponse.FinalText(text.toString());
    }

    private ObjectNode toJson(ContentBlock block) {
        ObjectNode node = objectMapper.createObjectNode();
        if (block instanceof ContentBlock.Text text) {
            node.put("type", "text");
            node.put("text", text.text());
        } else if (block instanceof ContentBlock.ToolUse toolUse) {
            node.put("type", "tool_use");
            node.put("id", toolUse.id());
            node.put("name", toolUse.name());
            node.set("input", objectMapper.valueToTree(toolUse.input()));
        } else if (block instanceof ContentBlock.ToolResult toolResult) {
            node.put("type", "tool_result");
            node.put("tool_use_id", toolResult.toolUseId());
            node.put("content", toolResult.content());
        }
        return node;
    }
}
