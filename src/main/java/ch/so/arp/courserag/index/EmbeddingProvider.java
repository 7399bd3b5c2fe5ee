package ch.so.arp.courserag.index;

import java.util.List;

/**
 * Strategy abstraction used to compute embeddings for course titles, chunks and
 * questions. Implementations can either call a remote embedding model or
 * provide deterministic vectors that are suited for tests and local
 * development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     */
    float[] embed(String text);

    /**
     * Create embeddings for several texts, preserving their order.
     */
    default List<float[]> embedAll(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }

    /**
     * Name of the model the vectors were produced with.
     */
    String modelName();

    int dimensions();
}
