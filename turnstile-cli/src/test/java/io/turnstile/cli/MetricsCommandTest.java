package io.turnstile.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.turnstile.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MetricsCommandTest {

    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPrintSessionMetricsFromGateway() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"session_id\":\"s-1\",\"turn_count\":2,\"protocol_violations\":1}"));

        String out = run(0, "--url", server.url("/").toString(), "--session", "s-1");

        assertThat(out).contains("\"turn_count\" : 2");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/metrics/session/s-1");
    }

    @Test
    void shouldTriggerExportOnGateway() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"status\":\"exported\",\"path\":\"/tmp/metrics-20260101-000000.json\"}"));

        String out = run(0, "--url", server.url("").toString(), "--export");

        assertThat(out).contains("Exported metrics to /tmp/metrics-20260101-000000.json");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/metrics/export");
    }

    @Test
    void shouldFailOnGatewayError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":\"session not found\"}"));

        run(1, "--url", server.url("/").toString(), "--session", "missing");
    }

    private String run(int expectedCode, String... args) {
        CliContext context = new CliContext(
            settings -> {
                throw new UnsupportedOperationException("not used");
            },
            new ConfigService(),
            tempDir.resolve("config.json")
        );
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new MetricsCommand(context)).execute(args);
            assertThat(code).isEqualTo(expectedCode);
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
