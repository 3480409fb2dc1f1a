package io.turnstile.core.provider;

import io.turnstile.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Provider placeholder used when a provider is not configured.
 * Always fails so fallback chains can skip it.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        throw new LlmProviderException(name, "provider " + name + " is not configured (" + reason + ")");
    }
}
