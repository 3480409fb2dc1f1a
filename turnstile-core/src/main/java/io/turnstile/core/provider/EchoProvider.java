package io.turnstile.core.provider;

import io.turnstile.core.content.ResponseNormalizer;
import io.turnstile.core.model.ChatMessage;
import io.turnstile.core.model.MessageRole;
import java.util.List;
import java.util.Map;

/**
 * Offline engine that answers with the latest user message. Never requests tools.
 */
public final class EchoProvider implements LlmProvider {
    private final String name;

    public EchoProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        String lastUserMessage = messages.stream()
            .filter(message -> message.role() == MessageRole.USER)
            .reduce((first, second) -> second)
            .map(message -> ResponseNormalizer.extractText(message.content()))
            .orElse("");

        return LlmResponse.text("[" + name + "] " + lastUserMessage);
    }
}
