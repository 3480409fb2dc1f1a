package io.turnstile.core.provider;

import io.turnstile.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Completion engine port. Implementations either return a response or throw
 * {@link LlmProviderException}; they never encode failures as response text.
 */
public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools);
}
