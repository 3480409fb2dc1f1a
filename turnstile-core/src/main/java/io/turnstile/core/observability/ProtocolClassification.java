package io.turnstile.core.observability;

public enum ProtocolClassification {
    COMPLIANT,
    VIOLATED,
    PARTIAL;

    public boolean isViolation() {
        return this != COMPLIANT;
    }
}
