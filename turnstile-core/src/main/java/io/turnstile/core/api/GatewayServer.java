package io.turnstile.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.turnstile.core.agent.TurnEvent;
import io.turnstile.core.agent.TurnOrchestrator;
import io.turnstile.core.agent.TurnStream;
import io.turnstile.core.model.ToolCall;
import io.turnstile.core.observability.MetricsStore;
import io.turnstile.core.observability.MetricsSummary;
import io.turnstile.core.observability.SessionMetrics;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front end for the orchestrator: blocking and SSE chat, session deletion and metrics.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final TurnOrchestrator orchestrator;
    private final MetricsStore metricsStore;
    private final String version;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, String host, TurnOrchestrator orchestrator, MetricsStore metricsStore, String version) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.metricsStore = metricsStore;
        this.version = version == null || version.isBlank() ? "dev" : version;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/health", this::handleHealth)
            .addExactPath("/chat", blocking(this::handleChat))
            .addExactPath("/chat/stream", blocking(this::handleChatStream))
            .addPrefixPath("/sessions", blocking(this::handleSessions))
            .addExactPath("/metrics", blocking(this::handleMetrics))
            .addPrefixPath("/metrics/session", blocking(this::handleSessionMetrics))
            .addExactPath("/metrics/export", blocking(this::handleExport));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private HttpHandler blocking(HttpHandler handler) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> {
                    try {
                        handler.handleRequest(exchange);
                    } catch (Exception e) {
                        sendInternalError(exchange, e);
                    }
                });
                return;
            }
            handler.handleRequest(exchange);
        };
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        if (origin.isBlank() || !isAllowedCorsOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,DELETE,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isAllowedCorsOrigin(String origin) {
        try {
            URI uri = URI.create(origin);
            String scheme = uri.getScheme();
            String hostName = uri.getHost();
            if (scheme == null || hostName == null) {
                return false;
            }
            return "http".equalsIgnoreCase(scheme)
                && ("localhost".equalsIgnoreCase(hostName) || "127.0.0.1".equals(hostName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok", "agent", "turnstile", "version", version));
    }

    private void handleChat(HttpServerExchange exchange) throws Exception {
        ChatRequest request = readChatRequest(exchange);
        if (request == null) {
            return;
        }
        TurnEvent terminal;
        try (TurnStream stream = orchestrator.submitTurn(request.sessionId(), request.message())) {
            terminal = stream.awaitTerminal();
        }
        if (terminal instanceof TurnEvent.TurnCompleted completed) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("session_id", completed.sessionId());
            payload.put("response", completed.response());
            payload.put("tool_calls", completed.toolCalls().isEmpty() ? null : toolCallsPayload(completed.toolCalls()));
            sendJson(exchange, 200, payload);
            return;
        }
        TurnEvent.TurnFailed failed = (TurnEvent.TurnFailed) terminal;
        sendJson(exchange, 502, Map.of(
            "error", failed.reason(),
            "session_id", failed.sessionId(),
            "partial_output", failed.partialOutput()
        ));
    }

    private void handleChatStream(HttpServerExchange exchange) throws Exception {
        ChatRequest request = readChatRequest(exchange);
        if (request == null) {
            return;
        }
        TurnStream stream = orchestrator.submitTurn(request.sessionId(), request.message());
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-cache");
        try (stream) {
            OutputStream out = exchange.getOutputStream();
            for (TurnEvent event : stream) {
                writeFrame(out, toFrame(event));
            }
        } catch (IOException e) {
            LOG.debug("Stream client for session {} went away: {}", stream.sessionId(), e.getMessage());
        } finally {
            exchange.endExchange();
        }
    }

    private void handleSessions(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "DELETE")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String sessionId = pathId(exchange);
        if (sessionId.isBlank()) {
            sendJson(exchange, 400, Map.of("error", "session_id is required"));
            return;
        }
        if (!orchestrator.deleteSession(sessionId)) {
            sendJson(exchange, 404, Map.of("error", "session not found", "session_id", sessionId));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "deleted", "session_id", sessionId));
    }

    private void handleMetrics(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Map<String, Object> sessions = new LinkedHashMap<>();
        orchestrator.getAllMetrics().forEach((id, metrics) -> sessions.put(id, sessionPayload(metrics)));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessions", sessions);
        payload.put("summary", summaryPayload(orchestrator.exportMetrics().summary()));
        sendJson(exchange, 200, payload);
    }

    private void handleSessionMetrics(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String sessionId = pathId(exchange);
        var metrics = orchestrator.getSessionMetrics(sessionId);
        if (metrics.isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "session not found", "session_id", sessionId));
            return;
        }
        sendJson(exchange, 200, sessionPayload(metrics.get()));
    }

    private void handleExport(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        if (metricsStore == null) {
            sendJson(exchange, 503, Map.of("error", "metrics_store_not_configured"));
            return;
        }
        Path path = metricsStore.save(orchestrator.exportMetrics());
        LOG.info("Exported metrics to {}", path);
        sendJson(exchange, 200, Map.of("status", "exported", "path", path.toString()));
    }

    private ChatRequest readChatRequest(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return null;
        }
        JsonNode body;
        try {
            body = readJsonBody(exchange);
        } catch (JsonProcessingException e) {
            sendJson(exchange, 400, Map.of("error", "invalid JSON body"));
            return null;
        }
        String message = body.path("message").asText("");
        if (message.isBlank()) {
            sendJson(exchange, 400, Map.of("error", "message is required"));
            return null;
        }
        String sessionId = body.path("session_id").isTextual() ? body.path("session_id").asText() : null;
        return new ChatRequest(message, sessionId);
    }

    private Map<String, Object> toFrame(TurnEvent event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        if (event instanceof TurnEvent.TextDelta delta) {
            frame.put("type", "text");
            frame.put("content", delta.text());
        } else if (event instanceof TurnEvent.ToolCallRequested call) {
            frame.put("type", "tool_call");
            frame.put("id", call.id());
            frame.put("name", call.name());
            frame.put("args", call.arguments());
        } else if (event instanceof TurnEvent.TurnCompleted completed) {
            frame.put("type", "done");
            frame.put("session_id", completed.sessionId());
        } else if (event instanceof TurnEvent.TurnFailed failed) {
            frame.put("type", "error");
            frame.put("session_id", failed.sessionId());
            frame.put("reason", failed.reason());
            frame.put("partial_output", failed.partialOutput());
        }
        return frame;
    }

    private void writeFrame(OutputStream out, Map<String, Object> frame) throws IOException {
        out.write(("data: " + mapper.writeValueAsString(frame) + "\n\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private List<Map<String, Object>> toolCallsPayload(List<ToolCall> calls) {
        return calls.stream()
            .map(call -> Map.<String, Object>of("name", call.name(), "args", call.arguments()))
            .toList();
    }

    private Map<String, Object> sessionPayload(SessionMetrics metrics) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", metrics.sessionId());
        payload.put("turn_count", metrics.turnCount());
        payload.put("completed_turns", metrics.completedTurns());
        payload.put("failed_turns", metrics.failedTurns());
        payload.put("tool_call_count", metrics.toolInvocationCount());
        payload.put("protocol_violations", metrics.violationCount());
        payload.put("avg_response_time_ms", metrics.averageLatencyMs());
        payload.put("total_response_time_ms", metrics.totalLatencyMs());
        payload.put("tools_used", metrics.toolsUsed());
        payload.put("first_seen", metrics.firstSeen() == null ? null : metrics.firstSeen().toString());
        payload.put("last_seen", metrics.lastSeen() == null ? null : metrics.lastSeen().toString());
        return payload;
    }

    private Map<String, Object> summaryPayload(MetricsSummary summary) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("total_sessions", summary.totalSessions());
        payload.put("total_turns", summary.totalTurns());
        payload.put("completed_turns", summary.completedTurns());
        payload.put("failed_turns", summary.failedTurns());
        payload.put("total_tool_calls", summary.totalToolInvocations());
        payload.put("protocol_violations", summary.protocolViolations());
        payload.put("p50_latency_ms", summary.p50LatencyMs());
        payload.put("p95_latency_ms", summary.p95LatencyMs());
        return payload;
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        JsonNode node = mapper.readTree(bytes);
        return node == null ? mapper.createObjectNode() : node;
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException | IllegalStateException e) {
            LOG.debug("Could not send error response: {}", e.getMessage());
        }
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private String pathId(HttpServerExchange exchange) {
        String relative = exchange.getRelativePath();
        String id = relative == null ? "" : relative;
        while (id.startsWith("/")) {
            id = id.substring(1);
        }
        return id.trim();
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }

    private record ChatRequest(String message, String sessionId) {
    }
}
