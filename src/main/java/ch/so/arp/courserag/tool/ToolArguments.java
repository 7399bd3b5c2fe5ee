package ch.so.arp.courserag.tool;

import java.util.Map;

/**
 * Helpers reading loosely typed tool arguments as produced by JSON decoding.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String requireString(Map<String, Object> arguments, String name) {
        String value = optionalString(arguments, name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument '" + name + "'");
        }
        return value;
    }

    static String optionalString(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    static Integer optionalInteger(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an integer but was '" + text + "'",
                    ex);
        }
    }
}
