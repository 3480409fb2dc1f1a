package io.turnstile.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.turnstile.core.content.ResponseNormalizer;
import io.turnstile.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FallbackLlmProviderTest {

    @Test
    void shouldUseNextProviderWhenFirstFails() {
        LlmProvider primary = new DisabledProvider("primary", "timeout");
        LlmProvider secondary = new StubProvider("secondary", "ok");

        FallbackLlmProvider provider = new FallbackLlmProvider("openrouter", List.of(primary, secondary));

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")), List.of());

        assertThat(ResponseNormalizer.extractText(response.content())).isEqualTo("ok");
    }

    @Test
    void shouldRethrowLastFailureWhenChainIsExhausted() {
        FallbackLlmProvider provider = new FallbackLlmProvider("openrouter", List.of(
            new DisabledProvider("first", "no key"),
            new DisabledProvider("second", "no key either")
        ));

        assertThatThrownBy(() -> provider.chat("model", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOfSatisfying(LlmProviderException.class, e -> assertThat(e.provider()).isEqualTo("second"));
    }

    private record StubProvider(String name, String content) implements LlmProvider {
        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
            return LlmResponse.text(content);
        }
    }
}
