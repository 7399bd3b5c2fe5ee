package ch.so.arp.courserag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.courserag.index.VectorIndex;
import ch.so.arp.courserag.ingest.CourseDocumentParser;
import ch.so.arp.courserag.ingest.MalformedCourseDocumentException;
import ch.so.arp.courserag.ingest.ParsedCourseDocument;
import ch.so.arp.courserag.llm.DialogueOrchestrator;
import ch.so.arp.courserag.llm.DialogueResult;
import ch.so.arp.courserag.session.SessionStore;
import ch.so.arp.courserag.tool.ToolRegistry;

/**
 * Entry point of the course assistant. Loads course documents into the vector
 * index and answers questions by delegating to the dialogue orchestrator with
 * the registered tools and the conversation history of the session.
 */
@Service
public class CourseQueryService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CourseQueryService.class);

    private static final Set<String> DOCUMENT_EXTENSIONS = Set.of(".txt", ".md");

    private final VectorIndex vectorIndex;
    private final CourseDocumentParser documentParser;
    private final DialogueOrchestrator orchestrator;
    private final ToolRegistry toolRegistry;
    private final SessionStore sessionStore;

    public CourseQueryService(VectorIndex vectorIndex, CourseDocumentParser documentParser,
            DialogueOrchestrator orchestrator, ToolRegistry toolRegistry, SessionStore sessionStore) {
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.documentParser = Objects.requireNonNull(documentParser, "documentParser");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry");
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
    }

    /**
     * Parse a course document and store its catalog entry and chunks. Missing or
     * malformed documents are logged and reported as a failed result.
     */
    public IngestionResult ingest(Path file) {
        ParsedCourseDocument document = parse(file);
        if (document == null) {
            return IngestionResult.failed();
        }
        store(document);
        LOGGER.info("Added course '{}' with {} chunks from {}", document.course().title(), document.chunks().size(),
                file);
        return new IngestionResult(document.course(), document.chunks().size());
    }

    /**
     * Ingest every course document of a folder. Courses whose title is already
     * in the catalog are skipped.
     *
     * @param folder        folder containing {@code .txt} or {@code .md} files
     * @param clearExisting remove all indexed courses first
     */
    public FolderIngestionResult ingestFolder(Path folder, boolean clearExisting) {
        if (clearExisting) {
            LOGGER.info("Clearing existing courses before loading {}", folder);
            vectorIndex.clear();
        }
        if (!Files.isDirectory(folder)) {
            LOGGER.warn("Course folder {} does not exist", folder);
            return new FolderIngestionResult(0, 0);
        }

        List<Path> files;
        try (Stream<Path> entries = Files.list(folder)) {
            files = entries.filter(Files::isRegularFile).filter(CourseQueryService::isCourseDocument).sorted().toList();
        } catch (IOException ex) {
            LOGGER.warn("Unable to list course folder {}: {}", folder, ex.getMessage(), ex);
            return new FolderIngestionResult(0, 0);
        }

        Set<String> existingTitles = new HashSet<>(vectorIndex.listTitles());
        int coursesAdded = 0;
        int chunksAdded = 0;
        for (Path file : files) {
            ParsedCourseDocument document = parse(file);
            if (document == null) {
                continue;
            }
            String title = document.course().title();
            if (!existingTitles.add(title)) {
                LOGGER.info("Course '{}' already exists, skipping {}", title, file);
                continue;
            }
            store(document);
            coursesAdded++;
            chunksAdded += document.chunks().size();
            LOGGER.info("Added course '{}' with {} chunks", title, document.chunks().size());
        }
        LOGGER.info("Loaded {} courses with {} chunks from {}", coursesAdded, chunksAdded, folder);
        return new FolderIngestionResult(coursesAdded, chunksAdded);
    }

    /**
     * Answer a question.
     *
     * @param query     the user question
     * @param sessionId the conversation to continue, {@code null} starts a new one
     * @return the answer, its sources and the session it belongs to
     */
    public QueryAnswer query(String query, String sessionId) {
        String session = sessionId == null || sessionId.isBlank() ? sessionStore.create() : sessionId;
        String history = sessionStore.render(session);

        DialogueResult result;
        try {
            result = orchestrator.generate(query, history, toolRegistry.definitions(), toolRegistry);
        } finally {
            toolRegistry.resetSources();
        }

        sessionStore.append(session, query, result.answer());
        LOGGER.debug("Answered query in {} with {} sources", session, result.sources().size());
        return new QueryAnswer(result.answer(), result.sources(), session);
    }

    public CourseAnalytics courseAnalytics() {
        return new CourseAnalytics(vectorIndex.countCourses(), vectorIndex.listTitles());
    }

    public void clearSession(String sessionId) {
        sessionStore.clear(sessionId);
    }

    private ParsedCourseDocument parse(Path file) {
        try {
            return documentParser.parse(file);
        } catch (IOException ex) {
            LOGGER.warn("Unable to read course document {}: {}", file, ex.getMessage());
        } catch (MalformedCourseDocumentException ex) {
            LOGGER.warn("Skipping malformed course document {}: {}", file, ex.getMessage());
        }
        return null;
    }

    private void store(ParsedCourseDocument document) {
        vectorIndex.upsertCatalog(document.course());
        vectorIndex.upsertContent(document.chunks());
    }

    private static boolean isCourseDocument(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return DOCUMENT_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
