package io.turnstile.core.model;

import java.util.List;
import java.util.Objects;

public record ChatMessage(MessageRole role, MessageContent content, String toolCallId) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? MessageContent.text("") : content;
        if (role == MessageRole.TOOL && (toolCallId == null || toolCallId.isBlank())) {
            throw new IllegalArgumentException("tool message requires a correlation id");
        }
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, MessageContent.text(content), null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, MessageContent.text(content), null);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, MessageContent.text(content), null);
    }

    public static ChatMessage assistant(MessageContent content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, MessageContent.text(content), toolCallId);
    }

    public List<ToolCall> toolCalls() {
        return content.toolCalls();
    }
}
