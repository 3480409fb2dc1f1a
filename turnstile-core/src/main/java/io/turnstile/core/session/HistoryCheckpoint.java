package io.turnstile.core.session;

import io.turnstile.core.model.ChatMessage;
import java.util.List;

public record HistoryCheckpoint(List<ChatMessage> messages) {
    public HistoryCheckpoint {
        messages = List.copyOf(messages);
    }
}
