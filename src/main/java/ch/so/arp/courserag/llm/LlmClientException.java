package ch.so.arp.courserag.llm;

/**
 * Thrown when the language model backend fails. Not retried.
 */
public class LlmClientException extends RuntimeException {

    private final int statusCode;

    public LlmClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public LlmClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the backend, or {@code -1} for transport failures.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
