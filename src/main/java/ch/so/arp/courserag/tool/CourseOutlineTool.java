package ch.so.arp.courserag.tool;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.course.Lesson;
import ch.so.arp.courserag.retrieval.CourseRetrievalEngine;

/**
 * Returns the outline of a course straight from the catalog: title, link,
 * instructor and the ordered lesson list. No content search is involved.
 */
public class CourseOutlineTool implements Tool {

    public static final String NAME = "get_course_outline";

    private static final ToolDefinition DEFINITION = new ToolDefinition(NAME,
            "Get the complete outline of a course: title, course link, instructor and the full lesson list",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "course_name", Map.of(
                                    "type", "string",
                                    "description", "Course title (partial matches work, e.g. 'MCP', 'Introduction')")),
                    "required", List.of("course_name")));

    private final CourseRetrievalEngine retrievalEngine;

    public CourseOutlineTool(CourseRetrievalEngine retrievalEngine) {
        this.retrievalEngine = Objects.requireNonNull(retrievalEngine, "retrievalEngine");
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments) {
        String courseName = ToolArguments.requireString(arguments, "course_name");
        Optional<Course> course = retrievalEngine.resolveCourse(courseName);
        if (course.isEmpty()) {
            return ToolResult.plain("No course found matching '" + courseName + "'.");
        }
        return ToolResult.plain(format(course.get()));
    }

    static String format(Course course) {
        StringBuilder outline = new StringBuilder();
        outline.append("Course Title: ").append(course.title()).append('\n');
        if (course.courseLink() != null) {
            outline.append("Course Link: ").append(course.courseLink()).append('\n');
        }
        if (course.instructor() != null) {
            outline.append("Course Instructor: ").append(course.instructor()).append('\n');
        }
        List<Lesson> lessons = course.lessons();
        outline.append('\n').append("Lessons (").append(lessons.size()).append(" total):");
        for (Lesson lesson : lessons) {
            outline.append("\nLesson ").append(lesson.lessonNumber()).append(": ").append(lesson.title());
        }
        return outline.toString();
    }
}
