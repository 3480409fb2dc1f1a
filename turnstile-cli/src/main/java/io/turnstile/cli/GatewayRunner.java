package io.turnstile.cli;

@FunctionalInterface
public interface GatewayRunner {
    int run(int port) throws Exception;
}
