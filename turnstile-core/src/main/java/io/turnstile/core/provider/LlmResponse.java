package io.turnstile.core.provider;

import io.turnstile.core.model.MessageContent;
import io.turnstile.core.model.ToolCall;
import java.util.List;
import java.util.Map;

public record LlmResponse(MessageContent content, Map<String, Object> usage) {
    public LlmResponse {
        content = content == null ? MessageContent.text("") : content;
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmResponse text(String text) {
        return new LlmResponse(MessageContent.text(text), Map.of());
    }

    public List<ToolCall> toolCalls() {
        return content.toolCalls();
    }

    public boolean hasToolCalls() {
        return !toolCalls().isEmpty();
    }
}
