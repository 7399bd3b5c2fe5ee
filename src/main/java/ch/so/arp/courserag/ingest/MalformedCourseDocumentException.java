package ch.so.arp.courserag.ingest;

/**
 * Raised when a course document lacks the mandatory header lines or contains
 * an unusable lesson heading.
 */
public class MalformedCourseDocumentException extends Exception {

    public MalformedCourseDocumentException(String message) {
        super(message);
    }

    public MalformedCourseDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
