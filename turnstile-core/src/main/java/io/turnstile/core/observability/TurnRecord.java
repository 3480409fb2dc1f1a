package io.turnstile.core.observability;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable summary of one finished turn, successful or not.
 *
 * @param turnIndex             number of turns the session had completed before this one
 * @param askedQuestion         whether the text preceding the first tool request asked a question
 * @param clarificationQuestion first interrogative line of that text, empty if none
 * @param failureReason         empty for completed turns
 */
public record TurnRecord(
    String sessionId,
    Instant timestamp,
    int turnIndex,
    int toolInvocationCount,
    List<String> toolsUsed,
    boolean askedQuestion,
    String clarificationQuestion,
    long latencyMs,
    TurnOutcome outcome,
    ProtocolClassification classification,
    String failureReason
) {
    public TurnRecord {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
        clarificationQuestion = clarificationQuestion == null ? "" : clarificationQuestion;
        outcome = outcome == null ? TurnOutcome.COMPLETED : outcome;
        classification = classification == null ? ProtocolClassification.COMPLIANT : classification;
        failureReason = failureReason == null ? "" : failureReason;
    }

    public boolean completed() {
        return outcome == TurnOutcome.COMPLETED;
    }
}
