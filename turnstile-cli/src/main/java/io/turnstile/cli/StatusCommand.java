package io.turnstile.cli;

import io.turnstile.core.config.ConfigPaths;
import io.turnstile.core.config.model.AgentDefaults;
import io.turnstile.core.config.model.TurnstileConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show runtime and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TurnstileConfig config = context.loadConfig();
            AgentDefaults defaults = config.agents().defaults();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Default provider: " + (defaults.provider().isBlank() ? "(by model)" : defaults.provider()));
            System.out.println("Default model: " + defaults.model());
            System.out.println("History bound: " + defaults.maxHistoryMessages() + " messages");
            System.out.println("Tool timeout: " + defaults.toolTimeoutSeconds() + "s, max concurrent: " + defaults.maxConcurrentTools());
            System.out.println("Anthropic configured: " + config.providers().anthropic().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("Gateway: " + config.gateway().host() + ":" + config.gateway().port());
            System.out.println("Metrics dir: " + ConfigPaths.resolveMetricsDir(config.gateway().metricsDir()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
