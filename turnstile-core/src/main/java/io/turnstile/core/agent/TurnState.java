package io.turnstile.core.agent;

import java.util.EnumSet;
import java.util.Set;

public enum TurnState {
    AWAITING_INPUT,
    GENERATING_FIRST,
    DIRECT,
    TOOLS_REQUESTED,
    EXECUTING_TOOLS,
    GENERATING_FOLLOWUP,
    STREAMING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public boolean canMoveTo(TurnState next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || successors().contains(next);
    }

    private Set<TurnState> successors() {
        return switch (this) {
            case AWAITING_INPUT -> EnumSet.of(GENERATING_FIRST);
            case GENERATING_FIRST -> EnumSet.of(DIRECT, TOOLS_REQUESTED);
            case DIRECT -> EnumSet.of(STREAMING);
            case TOOLS_REQUESTED -> EnumSet.of(EXECUTING_TOOLS);
            case EXECUTING_TOOLS -> EnumSet.of(GENERATING_FOLLOWUP);
            case GENERATING_FOLLOWUP -> EnumSet.of(STREAMING);
            case STREAMING -> EnumSet.of(COMPLETE);
            case COMPLETE, FAILED -> EnumSet.noneOf(TurnState.class);
        };
    }
}
