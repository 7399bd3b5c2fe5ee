package ch.so.arp.courserag.tool;

import java.util.List;

import ch.so.arp.courserag.retrieval.Source;

/**
 * Outcome of a tool invocation. {@code carriesSources} tells whether the tool
 * performs retrieval; only such results replace the previously reported
 * sources, even when their own source list is empty.
 */
public record ToolResult(String text, List<Source> sources, boolean carriesSources) {

    public ToolResult {
        sources = List.copyOf(sources);
    }

    public static ToolResult plain(String text) {
        return new ToolResult(text, List.of(), false);
    }

    public static ToolResult withSources(String text, List<Source> sources) {
        return new ToolResult(text, sources, true);
    }
}
