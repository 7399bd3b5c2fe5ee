package ch.so.arp.courserag.index;

import ch.so.arp.courserag.course.Course;

/**
 * Closest catalog entry for a course name hint together with its distance.
 */
public record CatalogMatch(Course course, double distance) {
}
