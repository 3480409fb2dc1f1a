package io.turnstile.core.tool;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface Tool {
    String name();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    /**
     * Argument names listed under the schema's {@code required} key.
     */
    default List<String> requiredArguments() {
        Object required = schema().get("required");
        if (!(required instanceof List<?> names)) {
            return List.of();
        }
        return names.stream().map(String::valueOf).toList();
    }

    /**
     * Argument that may be filled from the session's latest user text when the engine leaves it
     * out. Tools that need exact arguments keep the default and fail instead.
     */
    default Optional<String> fallbackArgument() {
        return Optional.empty();
    }

    String execute(Map<String, Object> input, ToolContext context);
}
