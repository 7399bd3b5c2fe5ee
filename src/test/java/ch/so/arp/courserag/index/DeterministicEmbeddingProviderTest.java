package ch.so.arp.courserag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class DeterministicEmbeddingProviderTest {

    private final DeterministicEmbeddingProvider provider = new DeterministicEmbeddingProvider("test-model", 1024);

    @Test
    void producesSameUnitVectorForSameText() {
        float[] first = provider.embed("Building Towards Computer Use");
        float[] second = provider.embed("Building Towards Computer Use");

        assertThat(first).hasSize(1024).containsExactly(second);
        double norm = 0.0d;
        for (float value : first) {
            norm += value * value;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0d, within(1e-5));
    }

    @Test
    void ignoresCaseAndPunctuation() {
        assertThat(provider.embed("Intro to MCP!")).containsExactly(provider.embed("intro TO mcp"));
    }

    @Test
    void placesTextsSharingWordsCloser() {
        float[] query = provider.embed("Machine Learning");
        double related = InMemoryVectorIndex.cosineDistance(query, provider.embed("Course 1: Machine Learning"));
        double unrelated = InMemoryVectorIndex.cosineDistance(query, provider.embed("Cooking with herbs"));

        assertThat(related).isLessThan(unrelated);
    }

    @Test
    void returnsZeroVectorForBlankText() {
        assertThat(provider.embed("   ")).containsOnly(0.0f);
    }

    @Test
    void rejectsNonPositiveDimensions() {
        assertThatThrownBy(() -> new DeterministicEmbeddingProvider("test-model", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
