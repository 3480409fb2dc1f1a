package io.turnstile.core.provider;

import java.util.Locale;

public final class ProviderRouter {
    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return registry.find(preferredProvider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + preferredProvider));
        }

        String normalizedModel = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalizedModel.contains("claude") || normalizedModel.startsWith("anthropic/")) {
            return require("anthropic");
        }
        if (normalizedModel.startsWith("gpt") || normalizedModel.startsWith("o1") || normalizedModel.startsWith("openai/")) {
            return require("openai");
        }
        if (normalizedModel.equals("echo")) {
            return require("echo");
        }
        return require("openrouter");
    }

    private LlmProvider require(String name) {
        return registry.find(name)
            .orElseThrow(() -> new IllegalArgumentException("Provider " + name + " is not registered"));
    }
}
