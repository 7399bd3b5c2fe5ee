package ch.so.arp.courserag;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class CourseDocumentsLoaderTest {

    @Test
    void loadsConfiguredFolderWithoutClearing() {
        CourseQueryService courseQueryService = mock(CourseQueryService.class);
        when(courseQueryService.ingestFolder(Path.of("docs"), false)).thenReturn(new FolderIngestionResult(4, 120));
        CourseRagProperties properties = new CourseRagProperties();
        properties.setDocsPath("docs");

        new CourseDocumentsLoader(courseQueryService, properties).run(new DefaultApplicationArguments());

        verify(courseQueryService).ingestFolder(Path.of("docs"), false);
    }
}
