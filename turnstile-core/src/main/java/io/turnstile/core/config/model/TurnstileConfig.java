package io.turnstile.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TurnstileConfig(
    AgentsConfig agents,
    ProvidersConfig providers,
    GatewayConfig gateway
) {

    public static TurnstileConfig defaults() {
        return new TurnstileConfig(
            AgentsConfig.defaultConfig(),
            ProvidersConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}
