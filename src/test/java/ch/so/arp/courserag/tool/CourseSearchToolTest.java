package ch.so.arp.courserag.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import ch.so.arp.courserag.retrieval.CourseRetrievalEngine;
import ch.so.arp.courserag.retrieval.RetrievalOutcome;
import ch.so.arp.courserag.retrieval.Source;

class CourseSearchToolTest {

    private final CourseRetrievalEngine engine = mock(CourseRetrievalEngine.class);
    private final CourseSearchTool tool = new CourseSearchTool(engine);

    @Test
    void describesQueryAsOnlyRequiredArgument() {
        ToolDefinition definition = tool.definition();

        assertThat(definition.name()).isEqualTo("search_course_content");
        assertThat(definition.inputSchema()).containsEntry("required", List.of("query"));
        assertThat(definition.inputSchema().get("properties"))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsOnlyKeys("query", "course_name", "lesson_number");
    }

    @Test
    void forwardsArgumentsAndReturnsSources() {
        List<Source> sources = List.of(new Source("MCP - Lesson 2", "https://example.com/2"));
        when(engine.search("servers", "MCP", 2)).thenReturn(new RetrievalOutcome("[MCP - Lesson 2]\ntext", sources));

        ToolResult result = tool.execute(Map.of("query", "servers", "course_name", "MCP", "lesson_number", 2));

        assertThat(result.text()).isEqualTo("[MCP - Lesson 2]\ntext");
        assertThat(result.sources()).isEqualTo(sources);
        assertThat(result.carriesSources()).isTrue();
    }

    @Test
    void acceptsLessonNumberAsText() {
        when(engine.search("servers", null, 3)).thenReturn(new RetrievalOutcome("ok", List.of()));

        tool.execute(Map.of("query", "servers", "lesson_number", "3"));

        verify(engine).search("servers", null, 3);
    }

    @Test
    void treatsBlankCourseNameAsAbsent() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("query", "servers");
        arguments.put("course_name", " ");
        arguments.put("lesson_number", null);
        when(engine.search("servers", null, null)).thenReturn(new RetrievalOutcome("ok", List.of()));

        assertThat(tool.execute(arguments).text()).isEqualTo("ok");
    }

    @Test
    void failsOnMissingQueryThroughRegistry() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(tool);

        assertThat(registry.invoke(CourseSearchTool.NAME, Map.of()).text())
                .isEqualTo("Tool 'search_course_content' failed: Missing required argument 'query'");
    }
}
