package ch.so.arp.courserag;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Loads the course documents of {@code rag.docs-path} once the application has
 * started. Courses already in the index are kept.
 */
@Component
@ConditionalOnProperty(name = "rag.docs-path")
class CourseDocumentsLoader implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(CourseDocumentsLoader.class);

    private final CourseQueryService courseQueryService;
    private final CourseRagProperties properties;

    CourseDocumentsLoader(CourseQueryService courseQueryService, CourseRagProperties properties) {
        this.courseQueryService = courseQueryService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path folder = Path.of(properties.getDocsPath());
        LOGGER.info("Loading initial course documents from {}", folder.toAbsolutePath());
        FolderIngestionResult result = courseQueryService.ingestFolder(folder, false);
        LOGGER.info("Initial load finished: {} courses, {} chunks", result.coursesAdded(), result.chunksAdded());
    }
}
