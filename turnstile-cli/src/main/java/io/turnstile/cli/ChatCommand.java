package io.turnstile.cli;

import io.turnstile.core.agent.AgentSettings;
import io.turnstile.core.agent.TurnEvent;
import io.turnstile.core.agent.TurnOrchestrator;
import io.turnstile.core.agent.TurnStream;
import io.turnstile.core.config.model.TurnstileConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send one message and stream the reply")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String message;

    @Option(names = {"-s", "--session"}, description = "Session id (a new session is started when omitted)")
    String session;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TurnstileConfig config = context.loadConfig();
            AgentSettings defaults = config.agents().defaults().toSettings();
            AgentSettings settings = defaults.withProvider(
                provider != null ? provider : defaults.provider(),
                model != null ? model : defaults.model()
            );

            try (TurnOrchestrator orchestrator = context.orchestrators().create(settings);
                 TurnStream stream = orchestrator.submitTurn(session, message)) {
                for (TurnEvent event : stream) {
                    if (event instanceof TurnEvent.TextDelta delta) {
                        System.out.print(delta.text());
                        System.out.flush();
                    } else if (event instanceof TurnEvent.ToolCallRequested call) {
                        System.err.println("[tool] " + call.name());
                    } else if (event instanceof TurnEvent.TurnCompleted completed) {
                        System.out.println();
                        if (session == null) {
                            System.err.println("Session: " + completed.sessionId());
                        }
                    } else if (event instanceof TurnEvent.TurnFailed failed) {
                        if (failed.partialOutput()) {
                            System.out.println();
                        }
                        System.err.println("Turn failed: " + failed.reason());
                        return 1;
                    }
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}
