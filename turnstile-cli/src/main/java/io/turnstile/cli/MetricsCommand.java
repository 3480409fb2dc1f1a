package io.turnstile.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.concurrent.Callable;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Reads metrics from a running gateway; metrics live in the gateway process.
 */
@Command(name = "metrics", description = "Print or export protocol metrics of a running gateway")
public final class MetricsCommand implements Callable<Integer> {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final CliContext context;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    @Option(names = {"--url"}, description = "Gateway base URL (defaults to http://127.0.0.1:<configured port>)")
    String url;

    @Option(names = {"--session"}, description = "Only show metrics of this session")
    String session;

    @Option(names = {"--export"}, description = "Ask the gateway to write a metrics snapshot to its metrics directory")
    boolean export;

    public MetricsCommand(CliContext context) {
        this.context = context;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(Duration.ofSeconds(30))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public Integer call() {
        try {
            String base = url != null && !url.isBlank()
                ? url
                : "http://127.0.0.1:" + context.loadConfig().gateway().port();
            base = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;

            Request.Builder request = new Request.Builder();
            if (export) {
                request.url(base + "/metrics/export").post(RequestBody.create("{}", JSON));
            } else if (session != null && !session.isBlank()) {
                request.url(base + "/metrics/session/" + session.trim()).get();
            } else {
                request.url(base + "/metrics").get();
            }

            try (Response response = client.newCall(request.build()).execute()) {
                String body = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    System.err.println("Gateway returned HTTP " + response.code() + ": " + body);
                    return 1;
                }
                JsonNode json = mapper.readTree(body);
                if (export) {
                    System.out.println("Exported metrics to " + json.path("path").asText());
                } else {
                    System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json));
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Metrics command failed: " + e.getMessage());
            return 1;
        }
    }
}
