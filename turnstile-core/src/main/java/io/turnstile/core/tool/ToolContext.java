package io.turnstile.core.tool;

public record ToolContext(String sessionId) {

    public ToolContext {
        sessionId = sessionId == null ? "" : sessionId;
    }
}
