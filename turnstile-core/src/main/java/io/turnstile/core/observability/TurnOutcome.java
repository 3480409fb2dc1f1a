package io.turnstile.core.observability;

public enum TurnOutcome {
    COMPLETED,
    FAILED
}
