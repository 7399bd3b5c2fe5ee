package ch.so.arp.courserag.course;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Course as stored in the catalog. The title is the identifier: ingesting a
 * course with an existing title replaces the stored record.
 */
public record Course(String title, String courseLink, String instructor, List<Lesson> lessons) {

    public Course {
        Objects.requireNonNull(title, "title");
        lessons = lessons == null ? List.of() : List.copyOf(lessons);
    }

    public Optional<Lesson> lesson(int lessonNumber) {
        return lessons.stream().filter(lesson -> lesson.lessonNumber() == lessonNumber).findFirst();
    }
}
