package io.turnstile.cli;

import io.turnstile.core.agent.AgentSettings;
import io.turnstile.core.agent.TurnOrchestrator;

@FunctionalInterface
public interface OrchestratorFactory {
    /**
     * @throws IllegalArgumentException if no engine matches the settings' provider or model
     */
    TurnOrchestrator create(AgentSettings settings);
}
