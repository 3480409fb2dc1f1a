package io.turnstile.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.turnstile.core.agent.AgentSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String provider,
    String model,
    @JsonAlias({"system_prompt"}) String systemPrompt,
    @JsonAlias({"max_history_messages"}) int maxHistoryMessages,
    @JsonAlias({"tool_timeout_seconds"}) int toolTimeoutSeconds,
    @JsonAlias({"max_concurrent_tools"}) int maxConcurrentTools,
    @JsonAlias({"stream_chunk_size"}) int streamChunkSize,
    @JsonAlias({"stream_buffer_size"}) int streamBufferSize
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "",
            AgentSettings.DEFAULT_MODEL,
            AgentSettings.DEFAULT_SYSTEM_PROMPT,
            AgentSettings.DEFAULT_MAX_HISTORY_MESSAGES,
            (int) AgentSettings.DEFAULT_TOOL_TIMEOUT.toSeconds(),
            AgentSettings.DEFAULT_MAX_CONCURRENT_TOOLS,
            AgentSettings.DEFAULT_STREAM_CHUNK_SIZE,
            AgentSettings.DEFAULT_STREAM_BUFFER_SIZE
        );
    }

    /**
     * @throws IllegalArgumentException if the values do not form valid turn settings
     */
    public AgentSettings toSettings() {
        return new AgentSettings(
            systemPrompt,
            provider,
            model,
            maxHistoryMessages,
            Duration.ofSeconds(toolTimeoutSeconds),
            maxConcurrentTools,
            streamChunkSize,
            streamBufferSize
        );
    }
}
