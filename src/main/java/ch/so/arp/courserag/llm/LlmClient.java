package ch.so.arp.courserag.llm;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real Anthropic API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Send one request to the model.
     *
     * @param request system prompt, conversation and offered tools
     * @return final text or the tool calls the model asks for
     * @throws LlmClientException if the model cannot be reached or rejects the
     *                            request
     */
    LlmResponse complete(LlmRequest request);
}
