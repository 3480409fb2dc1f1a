package io.turnstile.app;

import io.turnstile.cli.ChatCommand;
import io.turnstile.cli.CliContext;
import io.turnstile.cli.GatewayCommand;
import io.turnstile.cli.MetricsCommand;
import io.turnstile.cli.OnboardCommand;
import io.turnstile.cli.OrchestratorFactory;
import io.turnstile.cli.StatusCommand;
import io.turnstile.cli.TurnstileCliCommand;
import io.turnstile.core.agent.AgentSettings;
import io.turnstile.core.agent.TurnOrchestrator;
import io.turnstile.core.api.GatewayServer;
import io.turnstile.core.config.ConfigPaths;
import io.turnstile.core.config.ConfigService;
import io.turnstile.core.config.model.ProviderConfig;
import io.turnstile.core.config.model.TurnstileConfig;
import io.turnstile.core.observability.FileMetricsStore;
import io.turnstile.core.observability.ProtocolMonitor;
import io.turnstile.core.provider.AnthropicProvider;
import io.turnstile.core.provider.DisabledProvider;
import io.turnstile.core.provider.EchoProvider;
import io.turnstile.core.provider.FallbackLlmProvider;
import io.turnstile.core.provider.LlmProvider;
import io.turnstile.core.provider.OpenAiCompatProvider;
import io.turnstile.core.provider.ProviderRegistry;
import io.turnstile.core.provider.ProviderRouter;
import io.turnstile.core.tool.ToolExecutor;
import io.turnstile.core.tool.ToolRegistry;
import io.turnstile.core.tool.impl.PositioningReadinessTool;
import io.turnstile.core.tool.impl.ProductAnalysisTool;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class TurnstileApplication {
    private static final Logger LOG = LoggerFactory.getLogger(TurnstileApplication.class);
    private static final String VERSION = "0.1.0";

    private TurnstileApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        TurnstileConfig config = loadConfig(configService, configPath);

        ProviderRegistry providerRegistry = buildProviderRegistry(config);
        ToolRegistry toolRegistry = new ToolRegistry();
        toolRegistry.register(new ProductAnalysisTool());
        toolRegistry.register(new PositioningReadinessTool());
        ToolExecutor toolExecutor = new ToolExecutor(toolRegistry);
        ProtocolMonitor monitor = new ProtocolMonitor(Clock.systemUTC());

        OrchestratorFactory orchestrators = settings -> new TurnOrchestrator(
            new ProviderRouter(providerRegistry),
            toolExecutor,
            monitor,
            settings,
            Clock.systemUTC()
        );

        CliContext context = new CliContext(
            orchestrators,
            configService,
            configPath,
            System.getenv(),
            port -> runGateway(configService, configPath, port, orchestrators)
        );

        CommandLine commandLine = new CommandLine(new TurnstileCliCommand());
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("gateway", new GatewayCommand(context));
        commandLine.addSubcommand("metrics", new MetricsCommand(context));

        int exitCode = commandLine.execute(args);
        toolExecutor.close();
        System.exit(exitCode);
    }

    private static TurnstileConfig loadConfig(ConfigService configService, Path configPath) {
        TurnstileConfig config;
        try {
            config = configService.load(configPath);
        } catch (IOException e) {
            LOG.warn("Could not read {} ({}); using defaults", configPath, e.getMessage());
            config = TurnstileConfig.defaults();
        }
        return configService.applyEnvironment(config, System.getenv());
    }

    private static ProviderRegistry buildProviderRegistry(TurnstileConfig config) {
        LlmProvider anthropic = buildAnthropicProvider("anthropic", config.providers().anthropic(), "https://api.anthropic.com/v1");
        LlmProvider openai = buildOpenAiCompatProvider("openai", config.providers().openai(), "https://api.openai.com/v1");
        LlmProvider openrouter = buildOpenAiCompatProvider("openrouter", config.providers().openrouter(), "https://openrouter.ai/api/v1");

        ProviderRegistry providerRegistry = new ProviderRegistry();
        providerRegistry.register(new FallbackLlmProvider("anthropic", List.of(anthropic, openrouter, openai)));
        providerRegistry.register(new FallbackLlmProvider("openai", List.of(openai, openrouter, anthropic)));
        providerRegistry.register(new FallbackLlmProvider("openrouter", List.of(openrouter, openai, anthropic)));
        providerRegistry.register(new EchoProvider("echo"));
        return providerRegistry;
    }

    private static LlmProvider buildOpenAiCompatProvider(String name, ProviderConfig providerConfig, String defaultBase) {
        if (providerConfig != null && providerConfig.configured()) {
            return new OpenAiCompatProvider(
                name,
                providerConfig.apiKey(),
                providerConfig.apiBaseOr(defaultBase),
                providerConfig.extraHeaders()
            );
        }
        return new DisabledProvider(name, "missing API key");
    }

    private static LlmProvider buildAnthropicProvider(String name, ProviderConfig providerConfig, String defaultBase) {
        if (providerConfig != null && providerConfig.configured()) {
            return new AnthropicProvider(name, providerConfig.apiKey(), providerConfig.apiBaseOr(defaultBase));
        }
        return new DisabledProvider(name, "missing API key");
    }

    private static int runGateway(
        ConfigService configService,
        Path configPath,
        int port,
        OrchestratorFactory orchestrators
    ) throws Exception {
        TurnstileConfig config = configService.applyEnvironment(configService.load(configPath), System.getenv());
        AgentSettings settings = config.agents().defaults().toSettings();
        Path metricsDir = ConfigPaths.resolveMetricsDir(config.gateway().metricsDir());

        CountDownLatch shutdown = new CountDownLatch(1);
        try (TurnOrchestrator orchestrator = orchestrators.create(settings);
             GatewayServer server = new GatewayServer(
                 port,
                 config.gateway().host(),
                 orchestrator,
                 new FileMetricsStore(metricsDir),
                 VERSION
             )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://127.0.0.1:" + server.port()
                + " (provider " + orchestrator.providerName() + ", model " + settings.model() + ")");
            System.out.println("Endpoints: GET /health, POST /chat, POST /chat/stream, DELETE /sessions/{id}, "
                + "GET /metrics, GET /metrics/session/{id}, POST /metrics/export");
            shutdown.await();
        }
        return 0;
    }
}
