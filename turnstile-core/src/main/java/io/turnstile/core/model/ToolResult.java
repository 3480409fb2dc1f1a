package io.turnstile.core.model;

import java.util.Objects;

public record ToolResult(String toolCallId, String toolName, String output, String error) {

    public ToolResult {
        Objects.requireNonNull(toolCallId, "toolCallId must not be null");
        toolName = toolName == null ? "" : toolName;
        output = output == null ? "" : output;
    }

    public static ToolResult success(String toolCallId, String toolName, String output) {
        return new ToolResult(toolCallId, toolName, output, null);
    }

    public static ToolResult failure(String toolCallId, String toolName, String error) {
        return new ToolResult(toolCallId, toolName, "", error == null || error.isBlank() ? "execution_error" : error);
    }

    public boolean failed() {
        return error != null;
    }

    /**
     * Text handed back to the completion engine in the tool-role message.
     */
    public String content() {
        return failed() ? "Error: " + error : output;
    }
}
