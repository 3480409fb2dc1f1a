package io.turnstile.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.turnstile.core.agent.TurnOrchestrator;
import io.turnstile.core.config.ConfigService;
import io.turnstile.core.observability.ProtocolMonitor;
import io.turnstile.core.provider.OpenAiCompatProvider;
import io.turnstile.core.provider.ProviderRegistry;
import io.turnstile.core.provider.ProviderRouter;
import io.turnstile.core.tool.ToolExecutor;
import io.turnstile.core.tool.ToolRegistry;
import io.turnstile.core.tool.impl.ProductAnalysisTool;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ChatCommandIntegrationTest {

    private MockWebServer server;
    private ToolExecutor executor;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ToolRegistry tools = new ToolRegistry();
        tools.register(new ProductAnalysisTool());
        executor = new ToolExecutor(tools);
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.close();
        server.shutdown();
    }

    @Test
    void shouldStreamReplyFromHttpProvider() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "Who is your target customer?" } }
                  ]
                }
                """));

        Output output = run("A scheduling app for clinics");

        assertThat(output.code()).isZero();
        assertThat(output.out()).contains("Who is your target customer?");
        assertThat(output.err()).contains("Session: ");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getBody().readUtf8()).contains("\"model\":\"gpt-4o\"").contains("analyze_product");
    }

    @Test
    void shouldReportToolUseAndFollowUp() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [{
                    "message": {
                      "content": "",
                      "tool_calls": [{
                        "id": "call_1",
                        "type": "function",
                        "function": {"name": "analyze_product", "arguments": "{}"}
                      }]
                    }
                  }]
                }
                """));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"Analysis done.\"}}]}"));

        Output output = run("A scheduling app that helps clinics replace spreadsheets", "--session", "cli-1");

        assertThat(output.code()).isZero();
        assertThat(output.err()).contains("[tool] analyze_product").doesNotContain("Session: ");
        assertThat(output.out()).contains("Analysis done.");
        server.takeRequest();
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"tool_call_id\":\"call_1\"");
    }

    @Test
    void shouldExitWithErrorWhenProviderFails() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("invalid key"));

        Output output = run("hello there");

        assertThat(output.code()).isEqualTo(1);
        assertThat(output.err()).contains("Turn failed: HTTP 401");
    }

    private Output run(String... args) throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agents": {
                "defaults": {
                  "provider": "openrouter",
                  "model": "gpt-4o"
                }
              },
              "providers": {
                "openrouter": {
                  "apiKey": "sk-test",
                  "apiBase": "%s"
                }
              }
            }
            """.formatted(server.url("/v1").toString()), StandardCharsets.UTF_8);

        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new OpenAiCompatProvider("openrouter", "sk-test", server.url("/v1").toString(), Map.of(), 1));
        ProtocolMonitor monitor = new ProtocolMonitor(Clock.systemUTC());
        OrchestratorFactory factory = settings -> new TurnOrchestrator(
            new ProviderRouter(registry), executor, monitor, settings, Clock.systemUTC());
        CliContext context = new CliContext(factory, new ConfigService(), configPath);

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new ChatCommand(context)).execute(args);
            return new Output(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Output(int code, String out, String err) {
    }
}
