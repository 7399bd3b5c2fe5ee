package ch.so.arp.courserag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.index.DeterministicEmbeddingProvider;
import ch.so.arp.courserag.index.InMemoryVectorIndex;
import ch.so.arp.courserag.ingest.CourseDocumentParser;
import ch.so.arp.courserag.llm.DialogueOrchestrator;
import ch.so.arp.courserag.llm.LlmClient;
import ch.so.arp.courserag.llm.LlmClientException;
import ch.so.arp.courserag.llm.MockLlmClient;
import ch.so.arp.courserag.retrieval.CourseRetrievalEngine;
import ch.so.arp.courserag.session.SessionStore;
import ch.so.arp.courserag.tool.CourseOutlineTool;
import ch.so.arp.courserag.tool.CourseSearchTool;
import ch.so.arp.courserag.tool.ToolRegistry;

class CourseQueryServiceTest {

    private static final String MCP_COURSE = """
            Course Title: MCP: Build Rich-Context AI Apps with Anthropic
            Course Link: https://www.deeplearning.ai/short-courses/mcp-build-rich-context-ai-apps-with-anthropic/
            Course Instructor: Elie Schoppik

            Lesson 0: Introduction
            Lesson Link: https://learn.deeplearning.ai/courses/mcp/lesson/fkbhh/introduction
            The Model Context Protocol standardizes how applications provide context to language models.

            Lesson 1: Why MCP
            Lesson Link: https://learn.deeplearning.ai/courses/mcp/lesson/ccsd0/why-mcp
            Servers expose tools, resources and prompts to clients.
            """;

    private static final String RETRIEVAL_COURSE = """
            Course Title: Advanced Retrieval for AI with Chroma
            Course Instructor: Anton Troynikov

            Lesson 0: Introduction
            Retrieval augmented generation pulls relevant documents into the prompt.
            """;

    @TempDir
    Path tempDir;

    private InMemoryVectorIndex index;
    private ToolRegistry registry;
    private SessionStore sessionStore;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex(new DeterministicEmbeddingProvider("test-model", 2048));
        CourseRetrievalEngine engine = new CourseRetrievalEngine(index, 5, null);
        registry = new ToolRegistry();
        registry.register(new CourseSearchTool(engine));
        registry.register(new CourseOutlineTool(engine));
        sessionStore = new SessionStore(2);
    }

    @Test
    void ingestsSingleDocument() throws IOException {
        Path file = Files.writeString(tempDir.resolve("course1_script.txt"), MCP_COURSE);

        IngestionResult result = service(new MockLlmClient()).ingest(file);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.course().title()).isEqualTo("MCP: Build Rich-Context AI Apps with Anthropic");
        assertThat(result.chunkCount()).isEqualTo(2);
        assertThat(index.countCourses()).isEqualTo(1);
    }

    @Test
    void reportsMissingAndMalformedDocumentsAsFailed() throws IOException {
        Path malformed = Files.writeString(tempDir.resolve("broken.txt"), "no header at all");
        CourseQueryService service = service(new MockLlmClient());

        assertThat(service.ingest(tempDir.resolve("missing.txt"))).isEqualTo(new IngestionResult(null, 0));
        assertThat(service.ingest(malformed).succeeded()).isFalse();
        assertThat(index.countCourses()).isZero();
    }

    @Test
    void ingestsFolderOnlyOnce() throws IOException {
        Files.writeString(tempDir.resolve("course1_script.txt"), MCP_COURSE);
        Files.writeString(tempDir.resolve("course2_script.md"), RETRIEVAL_COURSE);
        Files.writeString(tempDir.resolve("notes.pdf"), MCP_COURSE);
        Files.writeString(tempDir.resolve("broken.txt"), "no header at all");
        CourseQueryService service = service(new MockLlmClient());

        FolderIngestionResult first = service.ingestFolder(tempDir, false);
        FolderIngestionResult second = service.ingestFolder(tempDir, false);

        assertThat(first).isEqualTo(new FolderIngestionResult(2, 3));
        assertThat(second).isEqualTo(new FolderIngestionResult(0, 0));
        assertThat(service.courseAnalytics().totalCourses()).isEqualTo(2);
        assertThat(service.courseAnalytics().courseTitles()).containsExactlyInAnyOrder(
                "MCP: Build Rich-Context AI Apps with Anthropic",
                "Advanced Retrieval for AI with Chroma");
    }

    @Test
    void reloadsFolderWhenClearingExisting() throws IOException {
        Files.writeString(tempDir.resolve("course1_script.txt"), MCP_COURSE);
        CourseQueryService service = service(new MockLlmClient());
        service.ingestFolder(tempDir, false);

        assertThat(service.ingestFolder(tempDir, true)).isEqualTo(new FolderIngestionResult(1, 2));
        assertThat(index.countCourses()).isEqualTo(1);
    }

    @Test
    void clearsIndexEvenWhenFolderIsMissing() {
        index.upsertCatalog(new Course("Old", null, null, List.of()));

        assertThat(service(new MockLlmClient()).ingestFolder(tempDir.resolve("docs"), true))
                .isEqualTo(new FolderIngestionResult(0, 0));
        assertThat(index.countCourses()).isZero();
    }

    @Test
    void keepsIndexWhenFolderIsMissingWithoutClearing() {
        index.upsertCatalog(new Course("Old", null, null, List.of()));

        assertThat(service(new MockLlmClient()).ingestFolder(tempDir.resolve("docs"), false))
                .isEqualTo(new FolderIngestionResult(0, 0));
        assertThat(index.countCourses()).isEqualTo(1);
    }

    @Test
    void reportsDocumentWithOversizedLessonNumberAsFailed() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.txt"), "Course Title: Bad\nLesson 99999999999: Huge\nText.");

        assertThat(service(new MockLlmClient()).ingest(file)).isEqualTo(new IngestionResult(null, 0));
    }

    @Test
    void continuesFolderPastDocumentWithOversizedLessonNumber() throws IOException {
        Files.writeString(tempDir.resolve("a_bad.txt"), "Course Title: Bad\nLesson 99999999999: Huge\nText.");
        Files.writeString(tempDir.resolve("b_good.txt"), MCP_COURSE);

        FolderIngestionResult result = service(new MockLlmClient()).ingestFolder(tempDir, false);

        assertThat(result).isEqualTo(new FolderIngestionResult(1, 2));
        assertThat(index.listTitles()).containsExactly("MCP: Build Rich-Context AI Apps with Anthropic");
    }

    @Test
    void answersWithSourcesAndRemembersExchange() throws IOException {
        Files.writeString(tempDir.resolve("course1_script.txt"), MCP_COURSE);
        CourseQueryService service = service(new MockLlmClient());
        service.ingestFolder(tempDir, false);

        QueryAnswer answer = service.query("What do MCP servers expose?", null);

        assertThat(answer.sessionId()).isEqualTo("session_1");
        assertThat(answer.answer()).startsWith("[mocked answer] Based on the course materials:");
        assertThat(answer.sources()).isNotEmpty();
        assertThat(answer.sources().get(0).label()).startsWith("MCP: Build Rich-Context AI Apps with Anthropic");
        assertThat(registry.lastSources()).isEmpty();
        assertThat(sessionStore.render("session_1")).startsWith("User: What do MCP servers expose?\nAssistant: ");
    }

    @Test
    void continuesGivenSession() {
        CourseQueryService service = service(new MockLlmClient());

        QueryAnswer first = service.query("First question", null);
        QueryAnswer second = service.query("Second question", first.sessionId());

        assertThat(second.sessionId()).isEqualTo(first.sessionId());
        assertThat(sessionStore.history(first.sessionId())).hasSize(2);
    }

    @Test
    void propagatesBackendFailureWithoutRecordingExchange() {
        LlmClient failing = mock(LlmClient.class);
        when(failing.complete(any())).thenThrow(new LlmClientException("Anthropic API error [500]", 500));
        CourseQueryService service = service(failing);

        assertThatThrownBy(() -> service.query("q", "session_9")).isInstanceOf(LlmClientException.class);
        assertThat(sessionStore.history("session_9")).isEmpty();
    }

    @Test
    void resetsSourcesWhenBackendFails() throws IOException {
        service(new MockLlmClient()).ingest(Files.writeString(tempDir.resolve("course1_script.txt"), MCP_COURSE));
        registry.invoke(CourseSearchTool.NAME, Map.of("query", "MCP servers"));
        assertThat(registry.lastSources()).isNotEmpty();
        LlmClient failing = mock(LlmClient.class);
        when(failing.complete(any())).thenThrow(new LlmClientException("Anthropic API error [500]", 500));
        CourseQueryService service = service(failing);

        assertThatThrownBy(() -> service.query("q", null)).isInstanceOf(LlmClientException.class);
        assertThat(registry.lastSources()).isEmpty();
    }

    private CourseQueryService service(LlmClient llmClient) {
        return new CourseQueryService(index, new CourseDocumentParser(800, 100), new DialogueOrchestrator(llmClient),
                registry, sessionStore);
    }
}
