package ch.so.arp.courserag.course;

/**
 * A single lesson of a {@link Course}. The lesson number is unique within its
 * course but the numbering does not have to be contiguous.
 */
public record Lesson(int lessonNumber, String title, String lessonLink) {
}
