package ch.so.arp.courserag.tool;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import ch.so.arp.courserag.retrieval.CourseRetrievalEngine;
import ch.so.arp.courserag.retrieval.RetrievalOutcome;

/**
 * Semantic search over the course content, optionally restricted to one course
 * and lesson.
 */
public class CourseSearchTool implements Tool {

    public static final String NAME = "search_course_content";

    private static final ToolDefinition DEFINITION = new ToolDefinition(NAME,
            "Search course materials with smart course name matching and lesson filtering",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "query", Map.of(
                                    "type", "string",
                                    "description", "What to search for in the course content"),
                            "course_name", Map.of(
                                    "type", "string",
                                    "description", "Course title (partial matches work, e.g. 'MCP', 'Introduction')"),
                            "lesson_number", Map.of(
                                    "type", "integer",
                                    "description", "Specific lesson number to search within (e.g. 1, 2, 3)")),
                    "required", List.of("query")));

    private final CourseRetrievalEngine retrievalEngine;

    public CourseSearchTool(CourseRetrievalEngine retrievalEngine) {
        this.retrievalEngine = Objects.requireNonNull(retrievalEngine, "retrievalEngine");
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments) {
        RetrievalOutcome outcome = retrievalEngine.search(
                ToolArguments.requireString(arguments, "query"),
                ToolArguments.optionalString(arguments, "course_name"),
                ToolArguments.optionalInteger(arguments, "lesson_number"));
        return ToolResult.withSources(outcome.text(), outcome.sources());
    }
}
