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
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat-completions client for OpenAI and compatible gateways such as OpenRouter. Accepts both
 * JSON and SSE responses and maps them onto a block list: text first, then tool requests in index
 * order.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders
    ) {
        this(name, apiKey, apiBase, extraHeaders, 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
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
        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = response.body() == null ? "" : response.body().string();
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        LOG.debug("Provider {} returned HTTP {}, retrying in {} ms", name, response.code(), delayMs);
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    throw new LlmProviderException(name, "HTTP " + response.code() + " " + errorBody);
                }

                ResponseBody body = response.body();
                if (body == null) {
                    throw new LlmProviderException(name, "empty response body");
                }

                String contentType = response.header("Content-Type", "");
                if (contentType.contains("text/event-stream")) {
                    return parseSse(body.source());
                }
                return parseJson(body.string());
            } catch (JsonProcessingException e) {
                throw new LlmProviderException(name, "malformed response from " + name + ": " + e.getOriginalMessage(), e);
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
        payload.put("messages", toWireMessages(messages));
        payload.put("stream", true);
        if (tools != null && !tools.isEmpty()) {
            payload.put("tools", tools);
            payload.put("tool_choice", "auto");
        }

        RequestBody body;
        try {
            body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException(name, "failed to encode request: " + e.getOriginalMessage(), e);
        }

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", ResponseNormalizer.extractText(message.content()));
            List<ToolCall> toolCalls = message.toolCalls();
            if (message.role() == MessageRole.ASSISTANT && !toolCalls.isEmpty()) {
                row.put("tool_calls", toWireToolCalls(toolCalls));
            }
            if (message.role() == MessageRole.TOOL) {
                row.put("tool_call_id", message.toolCallId());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", toArgumentsJson(call.arguments()));

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private String toArgumentsJson(Map<String, Object> arguments) {
        try {
            return mapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException(name, "failed to encode tool arguments: " + e.getOriginalMessage(), e);
        }
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case TOOL -> "tool";
        };
    }

    private LlmResponse parseJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode choices = root == null ? null : root.path("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new LlmProviderException(name, "response has no choices");
        }
        JsonNode message = choices.path(0).path("message");
        String content = message.path("content").asText("");
        List<ToolCall> toolCalls = parseToolCalls(message.path("tool_calls"));
        return new LlmResponse(toContent(content, toolCalls), usageAsMap(root.path("usage")));
    }

    private LlmResponse parseSse(BufferedSource source) throws IOException {
        StringBuilder content = new StringBuilder();
        Map<String, ToolCallBuffer> toolBuffers = new LinkedHashMap<>();
        Map<Integer, String> toolIdsByIndex = new LinkedHashMap<>();
        Map<String, Object> usage = Map.of();

        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }

            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }

            JsonNode event = mapper.readTree(payload);
            if (event.has("usage")) {
                usage = usageAsMap(event.path("usage"));
            }

            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.has("content") && !delta.path("content").isNull()) {
                    content.append(delta.path("content").asText(""));
                }
                collectToolCalls(delta.path("tool_calls"), toolBuffers, toolIdsByIndex);
            }
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (Map.Entry<String, ToolCallBuffer> entry : toolBuffers.entrySet()) {
            ToolCallBuffer buffer = entry.getValue();
            toolCalls.add(new ToolCall(entry.getKey(), buffer.name, parseArguments(buffer.arguments.toString())));
        }

        return new LlmResponse(toContent(content.toString(), toolCalls), usage);
    }

    private MessageContent toContent(String text, List<ToolCall> toolCalls) {
        if (toolCalls.isEmpty()) {
            return MessageContent.text(text);
        }
        List<ContentBlock> blocks = new ArrayList<>();
        if (!text.isEmpty()) {
            blocks.add(ContentBlock.text(text));
        }
        for (ToolCall call : toolCalls) {
            blocks.add(ContentBlock.toolRequest(call));
        }
        return MessageContent.blocks(blocks);
    }

    private List<ToolCall> parseToolCalls(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode item : node) {
            String id = item.path("id").asText("");
            JsonNode function = item.path("function");
            String toolName = function.path("name").asText("");
            Map<String, Object> args;
            JsonNode argsNode = function.path("arguments");
            if (argsNode.isTextual()) {
                args = parseArguments(argsNode.asText("{}"));
            } else if (argsNode.isObject()) {
                args = mapper.convertValue(argsNode, new TypeReference<Map<String, Object>>() {
                });
            } else {
                args = Map.of();
            }
            toolCalls.add(new ToolCall(id, toolName, args));
        }
        return toolCalls;
    }

    private void collectToolCalls(
        JsonNode toolCallsNode,
        Map<String, ToolCallBuffer> buffers,
        Map<Integer, String> toolIdsByIndex
    ) {
        if (toolCallsNode == null || !toolCallsNode.isArray()) {
            return;
        }
        for (JsonNode toolCall : toolCallsNode) {
            int index = toolCall.path("index").asInt(-1);
            String id = toolCall.path("id").asText();
            if (id != null && !id.isBlank() && index >= 0) {
                toolIdsByIndex.put(index, id);
            }
            if ((id == null || id.isBlank()) && index >= 0 && toolIdsByIndex.containsKey(index)) {
                id = toolIdsByIndex.get(index);
            }
            if (id == null || id.isBlank()) {
                index = Math.max(index, 0);
                id = "call_" + index;
            }

            ToolCallBuffer buffer = buffers.computeIfAbsent(id, ignored -> new ToolCallBuffer());
            JsonNode function = toolCall.path("function");
            if (function.has("name")) {
                String toolName = function.path("name").asText("");
                if (!toolName.isBlank()) {
                    buffer.name = toolName;
                }
            }
            if (function.has("arguments")) {
                String argChunk = function.path("arguments").asText("");
                if (!argChunk.isEmpty()) {
                    buffer.arguments.append(argChunk);
                }
            }
        }
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(usage, new TypeReference<Map<String, Object>>() {
        });
    }

    /**
     * Unparseable argument text yields an empty map; the executor then reports missing
     * arguments as a tool failure.
     */
    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            LOG.warn("Provider {} returned unparseable tool arguments: {}", name, e.getOriginalMessage());
            return Map.of();
        }
    }

    private static final class ToolCallBuffer {
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();
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
