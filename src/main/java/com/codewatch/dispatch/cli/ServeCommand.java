package com.codewatch.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: codewatch serve
 * <p>
 * Starts Codewatch as an HTTP server exposing the review API and SSE event streams.
 * The web server is enabled by {@link com.codewatch.CodewatchApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Codewatch HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Codewatch server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/reviews");
        System.out.println("  Metrics: http://localhost:" + port + "/actuator/metrics");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
