package io.turnstile.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    String host,
    int port,
    @JsonAlias({"metrics_dir"}) String metricsDir
) {

    public static GatewayConfig defaults() {
        return new GatewayConfig("0.0.0.0", 8123, "~/.turnstile/metrics");
    }
}
