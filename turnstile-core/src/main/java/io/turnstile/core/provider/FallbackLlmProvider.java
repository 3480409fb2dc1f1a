package io.turnstile.core.provider;

import io.turnstile.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        LlmProviderException last = new LlmProviderException(name, "no providers in fallback chain");
        for (LlmProvider provider : chain) {
            try {
                LlmResponse response = provider.chat(model, messages, tools);
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return response;
            } catch (LlmProviderException e) {
                LOG.warn("Provider {} failed in chain {}: {}", provider.name(), name, truncate(e.getMessage(), 300));
                last = e;
            }
        }
        throw last;
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
