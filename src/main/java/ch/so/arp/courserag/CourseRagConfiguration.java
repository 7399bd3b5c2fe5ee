package ch.so.arp.courserag;

import java.net.http.HttpClient;
import java.time.Duration;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.courserag.index.DeterministicEmbeddingProvider;
import ch.so.arp.courserag.index.EmbeddingProvider;
import ch.so.arp.courserag.index.InMemoryVectorIndex;
import ch.so.arp.courserag.index.PostgresVectorIndex;
import ch.so.arp.courserag.index.VectorIndex;
import ch.so.arp.courserag.ingest.CourseDocumentParser;
import ch.so.arp.courserag.llm.AnthropicClientProperties;
import ch.so.arp.courserag.llm.AnthropicLlmClient;
import ch.so.arp.courserag.llm.DialogueOrchestrator;
import ch.so.arp.courserag.llm.LlmClient;
import ch.so.arp.courserag.llm.MockLlmClient;
import ch.so.arp.courserag.retrieval.CourseRetrievalEngine;
import ch.so.arp.courserag.session.SessionStore;
import ch.so.arp.courserag.tool.CourseOutlineTool;
import ch.so.arp.courserag.tool.CourseSearchTool;
import ch.so.arp.courserag.tool.ToolRegistry;

/**
 * Central configuration wiring the course assistant together. It exposes
 * toggles that decide whether mocked or real infrastructure components should
 * be used.
 */
@Configuration
@EnableConfigurationProperties({ CourseRagProperties.class, AnthropicClientProperties.class })
public class CourseRagConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingProvider embeddingProvider(CourseRagProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getEmbeddingModel(), properties.getEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public VectorIndex inMemoryVectorIndex(EmbeddingProvider embeddingProvider) {
        return new InMemoryVectorIndex(embeddingProvider);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-vector-store", havingValue = "false")
    public VectorIndex postgresVectorIndex(JdbcClient jdbcClient, EmbeddingProvider embeddingProvider,
            ObjectProvider<ObjectMapper> objectMapper, CourseRagProperties properties) {
        PostgresVectorIndex index = new PostgresVectorIndex(jdbcClient, embeddingProvider,
                objectMapper.getIfAvailable(ObjectMapper::new));
        if (properties.isInitializeSchema()) {
            index.initializeSchema();
        }
        return index;
    }

    @Bean
    public CourseRetrievalEngine courseRetrievalEngine(VectorIndex vectorIndex, CourseRagProperties properties) {
        return new CourseRetrievalEngine(vectorIndex, properties.getMaxResults(),
                properties.getMaxResolutionDistance());
    }

    @Bean
    public ToolRegistry toolRegistry(CourseRetrievalEngine retrievalEngine) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new CourseSearchTool(retrievalEngine));
        registry.register(new CourseOutlineTool(retrievalEngine));
        return registry;
    }

    @Bean
    public SessionStore sessionStore(CourseRagProperties properties) {
        return new SessionStore(properties.getMaxHistory());
    }

    @Bean
    public CourseDocumentParser courseDocumentParser(CourseRagProperties properties) {
        return new CourseDocumentParser(properties.getChunkSize(), properties.getChunkOverlap());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-llm", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-llm", havingValue = "false")
    public LlmClient anthropicLlmClient(AnthropicClientProperties properties,
            ObjectProvider<ObjectMapper> objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
        return new AnthropicLlmClient(properties, objectMapper.getIfAvailable(ObjectMapper::new), httpClient);
    }

    @Bean
    public DialogueOrchestrator dialogueOrchestrator(LlmClient llmClient) {
        return new DialogueOrchestrator(llmClient);
    }
}
