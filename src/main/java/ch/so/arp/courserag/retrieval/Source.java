package ch.so.arp.courserag.retrieval;

/**
 * Provenance of a retrieved chunk: a display label such as
 * {@code "Intro to MCP - Lesson 2"} and the lesson link if one is known.
 */
public record Source(String label, String url) {
}
