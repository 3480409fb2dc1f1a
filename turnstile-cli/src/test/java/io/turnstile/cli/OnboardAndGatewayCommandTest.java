package io.turnstile.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.turnstile.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class OnboardAndGatewayCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void onboardShouldCreateThenRefreshConfig() throws Exception {
        Path configPath = tempDir.resolve(".turnstile/config.json");
        CliContext context = new CliContext(unused(), new ConfigService(), configPath);

        String first = capture(() -> new CommandLine(new OnboardCommand(context)).execute());
        String second = capture(() -> new CommandLine(new OnboardCommand(context)).execute("--overwrite"));

        assertThat(first).contains("Created config: " + configPath);
        assertThat(second).contains("Overwrote config with defaults");
        assertThat(Files.readString(configPath)).contains("\"maxHistoryMessages\" : 100");
    }

    @Test
    void statusShouldReflectEnvironmentOverrides() {
        CliContext context = new CliContext(
            unused(),
            new ConfigService(),
            tempDir.resolve("config.json"),
            Map.of("ANTHROPIC_API_KEY", "sk-ant", "TURNSTILE_MODEL", "claude-haiku"),
            port -> 0
        );

        String out = capture(() -> new CommandLine(new StatusCommand(context)).execute());

        assertThat(out).contains("Config exists: false");
        assertThat(out).contains("Default model: claude-haiku");
        assertThat(out).contains("Anthropic configured: true");
        assertThat(out).contains("OpenAI configured: false");
    }

    @Test
    void gatewayShouldUseConfiguredPortUnlessOverridden() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"gateway\":{\"port\":9123}}");
        AtomicInteger started = new AtomicInteger();
        CliContext context = new CliContext(unused(), new ConfigService(), configPath, Map.of(), port -> {
            started.set(port);
            return 0;
        });

        assertThat(new CommandLine(new GatewayCommand(context)).execute()).isZero();
        assertThat(started.get()).isEqualTo(9123);
        assertThat(new CommandLine(new GatewayCommand(context)).execute("--port", "7001")).isZero();
        assertThat(started.get()).isEqualTo(7001);
    }

    private static OrchestratorFactory unused() {
        return settings -> {
            throw new UnsupportedOperationException("not used");
        };
    }

    private static String capture(Runnable action) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
