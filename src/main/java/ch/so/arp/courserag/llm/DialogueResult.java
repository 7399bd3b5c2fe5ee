package ch.so.arp.courserag.llm;

import java.util.List;

import ch.so.arp.courserag.retrieval.Source;

/**
 * Final answer of a dialogue and the sources of the retrieval it used.
 */
public record DialogueResult(String answer, List<Source> sources) {

    public DialogueResult {
        sources = List.copyOf(sources);
    }
}
