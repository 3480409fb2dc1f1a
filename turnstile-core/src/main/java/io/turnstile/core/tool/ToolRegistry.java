package io.turnstile.core.tool;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to capability lookup shared by all sessions. Registration normally happens once at
 * startup; reads are lock-free.
 */
public final class ToolRegistry {
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public void register(Tool tool) {
        if (tool.name() == null || tool.name().isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
        tools.put(tool.name(), tool);
    }

    public Optional<Tool> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public List<Tool> all() {
        return tools.values().stream()
            .sorted(Comparator.comparing(Tool::name))
            .toList();
    }

    /**
     * Tool schema in function-calling form, ordered by tool name.
     */
    public List<Map<String, Object>> toolDefinitions() {
        return all().stream()
            .map(tool -> Map.<String, Object>of(
                "type", "function",
                "function", Map.of(
                    "name", tool.name(),
                    "description", tool.description(),
                    "parameters", tool.schema())))
            .toList();
    }
}
