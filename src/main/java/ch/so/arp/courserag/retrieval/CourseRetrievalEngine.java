package ch.so.arp.courserag.retrieval;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.course.CourseChunk;
import ch.so.arp.courserag.course.Lesson;
import ch.so.arp.courserag.index.CatalogMatch;
import ch.so.arp.courserag.index.MetadataFilter;
import ch.so.arp.courserag.index.SearchHit;
import ch.so.arp.courserag.index.SearchResults;
import ch.so.arp.courserag.index.VectorIndex;

/**
 * Searches course content on top of a {@link VectorIndex}. A course name hint is
 * first resolved to a catalog title by semantic similarity, then used together
 * with the lesson number as an exact metadata filter on the content query.
 */
public class CourseRetrievalEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(CourseRetrievalEngine.class);

    private final VectorIndex vectorIndex;
    private final int maxResults;
    private final Double maxResolutionDistance;

    /**
     * @param vectorIndex           the index to search
     * @param maxResults            number of chunks returned per search
     * @param maxResolutionDistance catalog matches further away than this are
     *                              rejected; {@code null} accepts the closest
     *                              title unconditionally
     */
    public CourseRetrievalEngine(VectorIndex vectorIndex, int maxResults, Double maxResolutionDistance) {
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        this.maxResults = maxResults;
        this.maxResolutionDistance = maxResolutionDistance;
    }

    /**
     * Search the course content.
     *
     * @param query        what to search for
     * @param courseName   optional, possibly partial course name
     * @param lessonNumber optional lesson number
     * @return formatted chunks with their sources, or a message explaining why
     *         nothing could be returned
     */
    public RetrievalOutcome search(String query, String courseName, Integer lessonNumber) {
        String courseTitle = null;
        if (courseName != null) {
            Optional<Course> course = resolveCourse(courseName);
            if (course.isEmpty()) {
                return RetrievalOutcome.message("No course found matching '" + courseName + "'.");
            }
            courseTitle = course.get().title();
        }

        SearchResults results = vectorIndex.queryContent(query, buildFilter(courseTitle, lessonNumber), maxResults);
        if (results.hasError()) {
            return RetrievalOutcome.message(results.error());
        }
        if (results.isEmpty()) {
            return RetrievalOutcome.message(noContentMessage(courseTitle, lessonNumber));
        }
        return format(results);
    }

    /**
     * Resolve a course name hint to the closest catalog entry.
     */
    public Optional<Course> resolveCourse(String courseName) {
        Optional<CatalogMatch> match = vectorIndex.queryCatalog(courseName);
        if (match.isEmpty()) {
            LOGGER.debug("Catalog is empty, cannot resolve '{}'", courseName);
            return Optional.empty();
        }
        CatalogMatch candidate = match.get();
        if (maxResolutionDistance != null && candidate.distance() > maxResolutionDistance) {
            LOGGER.debug("Rejected '{}' for '{}' at distance {}", candidate.course().title(), courseName,
                    candidate.distance());
            return Optional.empty();
        }
        LOGGER.debug("Resolved '{}' to '{}' (distance {})", courseName, candidate.course().title(),
                candidate.distance());
        return Optional.of(candidate.course());
    }

    /**
     * Build the content filter, e.g. {@code buildFilter(null, null)} is
     * {@link MetadataFilter#none()} and {@code buildFilter("X", 2)} is
     * {@code and(eq(course_title, "X"), eq(lesson_number, 2))}.
     */
    public static MetadataFilter buildFilter(String courseTitle, Integer lessonNumber) {
        if (courseTitle == null && lessonNumber == null) {
            return MetadataFilter.none();
        }
        if (lessonNumber == null) {
            return MetadataFilter.eq(CourseChunk.COURSE_TITLE, courseTitle);
        }
        if (courseTitle == null) {
            return MetadataFilter.eq(CourseChunk.LESSON_NUMBER, lessonNumber);
        }
        return MetadataFilter.and(
                MetadataFilter.eq(CourseChunk.COURSE_TITLE, courseTitle),
                MetadataFilter.eq(CourseChunk.LESSON_NUMBER, lessonNumber));
    }

    private RetrievalOutcome format(SearchResults results) {
        StringJoiner blocks = new StringJoiner("\n\n");
        List<Source> sources = new ArrayList<>();
        Map<String, Optional<Course>> courses = new HashMap<>();
        for (SearchHit hit : results.hits()) {
            Object title = hit.metadata().get(CourseChunk.COURSE_TITLE);
            Object lesson = hit.metadata().get(CourseChunk.LESSON_NUMBER);
            String label = title == null ? "unknown" : title.toString();
            if (lesson != null) {
                label += " - Lesson " + lesson;
            }
            blocks.add("[" + label + "]\n" + hit.document());

            String url = null;
            if (title != null && lesson instanceof Number number) {
                url = courses.computeIfAbsent(title.toString(), vectorIndex::findCourse)
                        .flatMap(course -> course.lesson(number.intValue()))
                        .map(Lesson::lessonLink)
                        .orElse(null);
            }
            sources.add(new Source(label, url));
        }
        return new RetrievalOutcome(blocks.toString(), sources);
    }

    private static String noContentMessage(String courseTitle, Integer lessonNumber) {
        StringBuilder message = new StringBuilder("No relevant content found");
        if (courseTitle != null) {
            message.append(" in course '").append(courseTitle).append('\'');
        }
        if (lessonNumber != null) {
            message.append(" in lesson ").append(lessonNumber);
        }
        return message.append('.').toString();
    }
}
