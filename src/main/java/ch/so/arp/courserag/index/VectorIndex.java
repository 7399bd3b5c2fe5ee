package ch.so.arp.courserag.index;

import java.util.List;
import java.util.Optional;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.course.CourseChunk;

/**
 * Vector index holding two collections: the catalog with one record per course
 * and the content with one record per chunk. Both support nearest-neighbour
 * search on their embeddings.
 */
public interface VectorIndex {

    /**
     * Store or overwrite the catalog record of a course. The course title is
     * embedded, lessons, instructor and link are kept as metadata of that single
     * record.
     */
    void upsertCatalog(Course course);

    /**
     * Store one content record per chunk. An empty list is a no-op.
     */
    void upsertContent(List<CourseChunk> chunks);

    /**
     * Find the course whose title is closest to the given hint.
     *
     * @param nameHint a possibly partial or misspelled course name
     * @return the closest match or empty if the catalog is empty
     */
    Optional<CatalogMatch> queryCatalog(String nameHint);

    /**
     * Find the chunks closest to the query among those matching the filter.
     * Backend failures are reported through {@link SearchResults#error()}.
     *
     * @param query  the text to search for
     * @param filter restriction on the chunk metadata
     * @param topK   the maximum number of hits
     * @return hits ordered by ascending distance
     */
    SearchResults queryContent(String query, MetadataFilter filter, int topK);

    Optional<Course> findCourse(String title);

    void clear();

    int countCourses();

    List<String> listTitles();

    List<Course> listAllCatalogMetadata();
}
