package io.turnstile.cli;

import io.turnstile.core.config.ConfigService;
import io.turnstile.core.config.model.TurnstileConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    OrchestratorFactory orchestrators,
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    GatewayRunner gatewayRunner
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliContext(OrchestratorFactory orchestrators, ConfigService configService, Path configPath) {
        this(orchestrators, configService, configPath, Map.of(), port -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }

    /**
     * Config file merged with defaults, then environment overrides.
     */
    public TurnstileConfig loadConfig() throws IOException {
        return configService.applyEnvironment(configService.load(configPath), environment);
    }
}
