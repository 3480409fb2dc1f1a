package io.turnstile.cli;

import picocli.CommandLine.Command;

@Command(name = "turnstile", mixinStandardHelpOptions = true, description = "Turnstile conversation turn orchestrator")
public final class TurnstileCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
