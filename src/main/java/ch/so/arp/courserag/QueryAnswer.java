package ch.so.arp.courserag;

import java.util.List;

import ch.so.arp.courserag.retrieval.Source;

/**
 * Answer to a user query, the sources it is based on and the session it was
 * recorded in.
 */
public record QueryAnswer(String answer, List<Source> sources, String sessionId) {
}
