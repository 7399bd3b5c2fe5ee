package ch.so.arp.courserag.tool;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.course.Lesson;
import ch.so.arp.courserag.index.DeterministicEmbeddingProvider;
import ch.so.arp.courserag.index.InMemoryVectorIndex;
import ch.so.arp.courserag.retrieval.CourseRetrievalEngine;

class CourseOutlineToolTest {

    private InMemoryVectorIndex index;
    private CourseOutlineTool tool;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex(new DeterministicEmbeddingProvider("test-model", 2048));
        tool = new CourseOutlineTool(new CourseRetrievalEngine(index, 5, null));
    }

    @Test
    void rendersOutlineOfResolvedCourse() {
        index.upsertCatalog(new Course("MCP: Build Rich-Context AI Apps with Anthropic",
                "https://example.com/mcp", "Elie Schoppik", List.of(
                        new Lesson(0, "Introduction", "https://example.com/mcp/0"),
                        new Lesson(1, "Why MCP", "https://example.com/mcp/1"))));

        ToolResult result = tool.execute(Map.of("course_name", "MCP"));

        assertThat(result.text()).isEqualTo("""
                Course Title: MCP: Build Rich-Context AI Apps with Anthropic
                Course Link: https://example.com/mcp
                Course Instructor: Elie Schoppik

                Lessons (2 total):
                Lesson 0: Introduction
                Lesson 1: Why MCP""");
        assertThat(result.carriesSources()).isFalse();
    }

    @Test
    void omitsMissingLinkAndInstructor() {
        String outline = CourseOutlineTool.format(new Course("Bare Course", null, null, List.of()));

        assertThat(outline).isEqualTo("Course Title: Bare Course\n\nLessons (0 total):");
    }

    @Test
    void reportsUnknownCourseWhenCatalogIsEmpty() {
        assertThat(tool.execute(Map.of("course_name", "Foo")).text()).isEqualTo("No course found matching 'Foo'.");
    }
}
