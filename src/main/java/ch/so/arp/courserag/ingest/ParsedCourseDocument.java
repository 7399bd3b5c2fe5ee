package ch.so.arp.courserag.ingest;

import java.util.List;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.course.CourseChunk;

/**
 * A course and the chunks of its lesson text, ready to be indexed.
 */
public record ParsedCourseDocument(Course course, List<CourseChunk> chunks) {

    public ParsedCourseDocument {
        chunks = List.copyOf(chunks);
    }
}
