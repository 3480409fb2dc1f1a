package io.turnstile.core.agent;

import io.turnstile.core.model.ToolCall;
import io.turnstile.core.observability.TurnRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Events delivered through a {@link TurnStream}. Every turn ends with exactly one terminal event.
 */
public sealed interface TurnEvent
    permits TurnEvent.TextDelta, TurnEvent.ToolCallRequested, TurnEvent.TurnCompleted, TurnEvent.TurnFailed {

    default boolean terminal() {
        return false;
    }

    record TextDelta(String text) implements TurnEvent {
        public TextDelta {
            text = text == null ? "" : text;
        }
    }

    record ToolCallRequested(String id, String name, Map<String, Object> arguments) implements TurnEvent {
        public ToolCallRequested {
            arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }

        static ToolCallRequested of(ToolCall call) {
            return new ToolCallRequested(call.id(), call.name(), call.arguments());
        }
    }

    /**
     * @param response all text streamed during the turn
     */
    record TurnCompleted(String sessionId, String response, List<ToolCall> toolCalls, TurnRecord record)
        implements TurnEvent {
        public TurnCompleted {
            response = response == null ? "" : response;
            toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    /**
     * @param partialOutput whether text fragments of this turn were already emitted; those
     *                      fragments belong to a message that will never be completed
     */
    record TurnFailed(String sessionId, String reason, boolean partialOutput) implements TurnEvent {
        public TurnFailed {
            reason = reason == null || reason.isBlank() ? "turn failed" : reason;
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }
}
