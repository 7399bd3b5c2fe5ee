package ch.so.arp.courserag;

import ch.so.arp.courserag.course.Course;

/**
 * Outcome of ingesting one document. {@code course} is {@code null} and
 * {@code chunkCount} is zero when the document could not be read.
 */
public record IngestionResult(Course course, int chunkCount) {

    static IngestionResult failed() {
        return new IngestionResult(null, 0);
    }

    public boolean succeeded() {
        return course != null;
    }
}
