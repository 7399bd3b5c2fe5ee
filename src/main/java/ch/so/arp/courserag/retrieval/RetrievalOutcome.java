package ch.so.arp.courserag.retrieval;

import java.util.List;

/**
 * Text handed to the language model for a search together with the sources of
 * the chunks it contains. Error and "nothing found" outcomes carry no sources.
 */
public record RetrievalOutcome(String text, List<Source> sources) {

    public RetrievalOutcome {
        sources = List.copyOf(sources);
    }

    static RetrievalOutcome message(String text) {
        return new RetrievalOutcome(text, List.of());
    }
}
