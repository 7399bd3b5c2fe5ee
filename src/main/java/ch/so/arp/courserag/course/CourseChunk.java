package ch.so.arp.courserag.course;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Piece of lesson text that is embedded and stored in the content collection.
 * The lesson number is {@code null} for documents without lesson markers.
 */
public record CourseChunk(String content, String courseTitle, Integer lessonNumber, int chunkIndex) {

    public static final String COURSE_TITLE = "course_title";
    public static final String LESSON_NUMBER = "lesson_number";
    public static final String CHUNK_INDEX = "chunk_index";

    public CourseChunk {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(courseTitle, "courseTitle");
    }

    /**
     * Metadata attached to the stored record. Keys with a {@code null} value are
     * left out.
     */
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(COURSE_TITLE, courseTitle);
        if (lessonNumber != null) {
            metadata.put(LESSON_NUMBER, lessonNumber);
        }
        metadata.put(CHUNK_INDEX, chunkIndex);
        return metadata;
    }
}
