package io.turnstile.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.turnstile.core.content.ResponseNormalizer;
import io.turnstile.core.model.ChatMessage;
import io.turnstile.core.model.ContentBlock;
import io.turnstile.core.model.MessageContent;
import io.turnstile.core.model.MessageRole;
import io.turnstile.core.model.ToolCall;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Messages API client. Response content is kept as an ordered block list so text emitted before
 * a tool request stays distinguishable from text emitted after it.
 */
public final class AnthropicProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(AnthropicProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 3);
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        if (apiKey.isBlank()) {
            throw new LlmProviderException(name, "missing API key for provider " + name);
        }
        Request request = buildRequest(model, messages, tools);
        String body = execute(request);
        try {
            return parseResponse(body);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException(name, "malformed response from " + name + ": " + e.getOriginalMessage(), e);
        }
    }

    private String execute(Request request) {
        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                String body = response.body() == null ? "" : response.body().string();
                if (response.isSuccessful()) {
                    return body;
                }
                boolean retryable = response.code() == 429 || response.code() >= 500;
                if (retryable && attempt < maxAttempts) {
                    LOG.debug("Provider {} returned HTTP {}, retrying in {} ms", name, response.code(), delayMs);
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new LlmProviderException(name, "HTTP " + response.code() + " " + body);
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    LOG.debug("Provider {} transport error, retrying in {} ms: {}", name, delayMs, ioe.getMessage());
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new LlmProviderException(name, "transport error: " + ioe.getMessage(), ioe);
            }
        }
        throw new LlmProviderException(name, "exhausted retries");
    }

    private Request buildRequest(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", 4096);
        payload.put("messages", toWireMessages(messages));

        String systemPrompt = extractSystemPrompt(messages);
        if (!systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }

        if (tools != null && !tools.isEmpty()) {
            payload.put("tools", toAnthropicTools(tools));
        }

        try {
            RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
            return new Request.Builder()
                .url(messagesUrl())
                .post(body)
                .header("x-api-key", apiKey)
                .header("anthropic-version", "2023-06-01")
                .header("content-type", "application/json")
                .build();
        } catch (JsonProcessingException e) {
            throw new LlmProviderException(name, "failed to encode request: " + e.getOriginalMessage(), e);
        }
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user");

            if (message.role() == MessageRole.TOOL) {
                row.put("content", List.of(Map.of(
                    "type", "tool_result",
                    "tool_use_id", message.toolCallId(),
                    "content", ResponseNormalizer.extractText(message.content())
                )));
            } else if (message.content() instanceof MessageContent.Blocks blocks) {
                row.put("content", toWireBlocks(blocks.blocks()));
            } else {
                row.put("content", ResponseNormalizer.extractText(message.content()));
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireBlocks(List<ContentBlock> blocks) {
        List<Map<String, Object>> content = new ArrayList<>();
        for (ContentBlock block : blocks) {
            if (block instanceof ContentBlock.Text text) {
                if (!text.text().isBlank()) {
                    content.add(Map.of("type", "text", "text", text.text()));
                }
            } else if (block instanceof ContentBlock.ToolRequest request) {
                ToolCall call = request.call();
                content.add(Map.of(
                    "type", "tool_use",
                    "id", call.id(),
                    "name", call.name(),
                    "input", call.arguments()
                ));
            }
        }
        return content;
    }

    private String extractSystemPrompt(List<ChatMessage> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.SYSTEM)
            .map(m -> ResponseNormalizer.extractText(m.content()))
            .reduce("", (a, b) -> a.isBlank() ? b : a + "\n\n" + b);
    }

    private List<Map<String, Object>> toAnthropicTools(List<Map<String, Object>> tools) {
        List<Map<String, Object>> mapped = new ArrayList<>();
        for (Map<String, Object> tool : tools) {
            Object fn = tool.get("function");
            if (!(fn instanceof Map<?, ?> fnMap)) {
                continue;
            }
            Object toolName = fnMap.get("name");
            if (!(toolName instanceof String s) || s.isBlank()) {
                continue;
            }
            Object description = fnMap.containsKey("description") ? fnMap.get("description") : "";
            Object parameters = fnMap.containsKey("parameters")
                ? fnMap.get("parameters")
                : Map.of("type", "object", "properties", Map.of());
            mapped.add(Map.of(
                "name", s,
                "description", String.valueOf(description),
                "input_schema", parameters
            ));
        }
        return mapped;
    }

    private LlmResponse parseResponse(String body) throws JsonProcessingException {
        JsonNode root = mapper.readTree(body);
        if (root == null || !root.path("content").isArray()) {
            throw new LlmProviderException(name, "response has no content array");
        }
        List<ContentBlock> blocks = new ArrayList<>();
        for (JsonNode item : root.path("content")) {
            String type = item.path("type").asText("");
            if ("text".equals(type)) {
                blocks.add(ContentBlock.text(item.path("text").asText("")));
            } else if ("tool_use".equals(type)) {
                Map<String, Object> input = item.path("input").isObject()
                    ? mapper.convertValue(item.path("input"), new TypeReference<Map<String, Object>>() {
                    })
                    : Map.of();
                blocks.add(ContentBlock.toolRequest(new ToolCall(
                    item.path("id").asText(""),
                    item.path("name").asText(""),
                    input
                )));
            }
        }

        Map<String, Object> usage = root.path("usage").isObject()
            ? mapper.convertValue(root.path("usage"), new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        return new LlmResponse(MessageContent.blocks(blocks), usage);
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmProviderException(name, "interrupted while backing off");
        }
    }
}
