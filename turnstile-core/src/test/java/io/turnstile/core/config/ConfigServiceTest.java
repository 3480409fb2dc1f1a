package io.turnstile.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.turnstile.core.agent.AgentSettings;
import io.turnstile.core.config.model.TurnstileConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");

        TurnstileConfig config = service.load(configPath);

        assertThat(config.agents().defaults().model()).isEqualTo(AgentSettings.DEFAULT_MODEL);
        assertThat(config.agents().defaults().maxHistoryMessages()).isEqualTo(100);
        assertThat(config.providers().anthropic().configured()).isFalse();
        assertThat(config.gateway().port()).isEqualTo(8123);
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agents": {
                "defaults": {
                  "model": "gpt-4o",
                  "toolTimeoutSeconds": 5
                }
              },
              "providers": {
                "openrouter": {
                  "apiKey": "sk-test"
                }
              }
            }
            """);

        TurnstileConfig config = service.load(configPath);

        assertThat(config.agents().defaults().model()).isEqualTo("gpt-4o");
        assertThat(config.agents().defaults().maxConcurrentTools()).isEqualTo(4);
        assertThat(config.agents().defaults().toSettings().toolTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.providers().openrouter().apiKey()).isEqualTo("sk-test");
        assertThat(config.providers().openai().apiKey()).isEqualTo("");
    }

    @Test
    void shouldLetEnvironmentOverrideKeysAndModel() {
        ConfigService service = new ConfigService();

        TurnstileConfig config = service.applyEnvironment(TurnstileConfig.defaults(), Map.of(
            "ANTHROPIC_API_KEY", " sk-ant ",
            "MODEL", "claude-haiku",
            "TURNSTILE_PROVIDER", "anthropic",
            "OPENAI_API_KEY", ""
        ));

        assertThat(config.providers().anthropic().apiKey()).isEqualTo("sk-ant");
        assertThat(config.providers().openai().configured()).isFalse();
        assertThat(config.agents().defaults().model()).isEqualTo("claude-haiku");
        assertThat(config.agents().defaults().provider()).isEqualTo("anthropic");
    }

    @Test
    void shouldPreferTurnstileModelOverGenericModelVariable() {
        ConfigService service = new ConfigService();

        TurnstileConfig config = service.applyEnvironment(TurnstileConfig.defaults(), Map.of(
            "TURNSTILE_MODEL", "gpt-4o",
            "MODEL", "claude-haiku"
        ));

        assertThat(config.agents().defaults().model()).isEqualTo("gpt-4o");
    }

    @Test
    void shouldRejectInvalidTurnSettings() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"agents\":{\"defaults\":{\"maxHistoryMessages\":1}}}");

        TurnstileConfig config = service.load(configPath);

        assertThatThrownBy(() -> config.agents().defaults().toSettings())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxHistoryMessages");
    }

    @Test
    void onboardShouldCreateConfigOnlyOnceUnlessOverwriting() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".turnstile/config.json");

        OnboardResult first = service.onboard(configPath, false);
        OnboardResult second = service.onboard(configPath, false);
        OnboardResult third = service.onboard(configPath, true);

        assertThat(first.createdConfig()).isTrue();
        assertThat(Files.exists(configPath)).isTrue();
        assertThat(second.createdConfig()).isFalse();
        assertThat(second.overwrittenConfig()).isFalse();
        assertThat(third.overwrittenConfig()).isTrue();
    }
}
