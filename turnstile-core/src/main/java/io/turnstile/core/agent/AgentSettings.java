package io.turnstile.core.agent;

import io.turnstile.core.session.HistoryManager;
import java.time.Duration;

/**
 * Per-deployment turn settings. Invalid values are configuration errors and fail construction,
 * so they surface at startup rather than on some later turn.
 */
public record AgentSettings(
    String systemPrompt,
    String provider,
    String model,
    int maxHistoryMessages,
    Duration toolTimeout,
    int maxConcurrentTools,
    int streamChunkSize,
    int streamBufferSize
) {
    public static final String DEFAULT_MODEL = "claude-sonnet-4-5";
    public static final String DEFAULT_SYSTEM_PROMPT = "You are Turnstile, a product positioning assistant. "
        + "On the first message of a conversation, ask one clarifying question and wait for the answer "
        + "before using any tool.";
    public static final int DEFAULT_MAX_HISTORY_MESSAGES = 100;
    public static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_CONCURRENT_TOOLS = 4;
    public static final int DEFAULT_STREAM_CHUNK_SIZE = 24;
    public static final int DEFAULT_STREAM_BUFFER_SIZE = 64;

    public AgentSettings {
        systemPrompt = systemPrompt == null ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
        provider = provider == null ? "" : provider.trim();
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        int minimum = HistoryManager.minimumBound(!systemPrompt.isBlank());
        if (maxHistoryMessages < minimum) {
            throw new IllegalArgumentException(
                "maxHistoryMessages must be at least " + minimum + " (got " + maxHistoryMessages + ")");
        }
        if (toolTimeout == null || toolTimeout.isZero() || toolTimeout.isNegative()) {
            throw new IllegalArgumentException("toolTimeout must be positive (got " + toolTimeout + ")");
        }
        if (maxConcurrentTools < 1) {
            throw new IllegalArgumentException("maxConcurrentTools must be at least 1 (got " + maxConcurrentTools + ")");
        }
        if (streamChunkSize < 1) {
            throw new IllegalArgumentException("streamChunkSize must be at least 1 (got " + streamChunkSize + ")");
        }
        if (streamBufferSize < 1) {
            throw new IllegalArgumentException("streamBufferSize must be at least 1 (got " + streamBufferSize + ")");
        }
    }

    public static AgentSettings defaults() {
        return new AgentSettings(
            DEFAULT_SYSTEM_PROMPT,
            "",
            DEFAULT_MODEL,
            DEFAULT_MAX_HISTORY_MESSAGES,
            DEFAULT_TOOL_TIMEOUT,
            DEFAULT_MAX_CONCURRENT_TOOLS,
            DEFAULT_STREAM_CHUNK_SIZE,
            DEFAULT_STREAM_BUFFER_SIZE
        );
    }

    public AgentSettings withProvider(String provider, String model) {
        return new AgentSettings(
            systemPrompt,
            provider,
            model,
            maxHistoryMessages,
            toolTimeout,
            maxConcurrentTools,
            streamChunkSize,
            streamBufferSize
        );
    }
}
