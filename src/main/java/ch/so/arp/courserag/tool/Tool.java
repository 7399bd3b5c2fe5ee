package ch.so.arp.courserag.tool;

import java.util.Map;

/**
 * Named unit of work the language model may ask to run during a dialogue.
 */
public interface Tool {

    ToolDefinition definition();

    /**
     * Run the tool.
     *
     * @param arguments the arguments chosen by the model, keyed by parameter name
     * @return the text returned to the model and the sources it is based on
     */
    ToolResult execute(Map<String, Object> arguments);

    default String name() {
        return definition().name();
    }
}
