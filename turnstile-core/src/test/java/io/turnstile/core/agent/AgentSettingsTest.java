package io.turnstile.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class AgentSettingsTest {

    @Test
    void shouldFillDefaults() {
        AgentSettings settings = new AgentSettings(null, null, " ", 100, Duration.ofSeconds(1), 1, 1, 1);

        assertThat(settings.systemPrompt()).isEqualTo(AgentSettings.DEFAULT_SYSTEM_PROMPT);
        assertThat(settings.provider()).isEmpty();
        assertThat(settings.model()).isEqualTo(AgentSettings.DEFAULT_MODEL);
    }

    @Test
    void shouldRequireRoomForOneMessageBesideSystemPrompt() {
        assertThatThrownBy(() -> new AgentSettings("system", "", "m", 1, Duration.ofSeconds(1), 1, 1, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least 2");
        assertThat(new AgentSettings("", "", "m", 1, Duration.ofSeconds(1), 1, 1, 1).maxHistoryMessages()).isEqualTo(1);
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> new AgentSettings("s", "", "m", 10, Duration.ZERO, 1, 1, 1))
            .hasMessageContaining("toolTimeout");
        assertThatThrownBy(() -> new AgentSettings("s", "", "m", 10, Duration.ofSeconds(1), 0, 1, 1))
            .hasMessageContaining("maxConcurrentTools");
        assertThatThrownBy(() -> new AgentSettings("s", "", "m", 10, Duration.ofSeconds(1), 1, 0, 1))
            .hasMessageContaining("streamChunkSize");
        assertThatThrownBy(() -> new AgentSettings("s", "", "m", 10, Duration.ofSeconds(1), 1, 1, 0))
            .hasMessageContaining("streamBufferSize");
    }

    @Test
    void shouldSwapProviderAndModelOnly() {
        AgentSettings settings = AgentSettings.defaults().withProvider("openai", "gpt-4o");

        assertThat(settings.provider()).isEqualTo("openai");
        assertThat(settings.model()).isEqualTo("gpt-4o");
        assertThat(settings.maxHistoryMessages()).isEqualTo(AgentSettings.DEFAULT_MAX_HISTORY_MESSAGES);
    }
}
