package com.shipyard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: shipyard serve
 * <p>
 * Runs the HTTP server. The web server is enabled by
 * {@link com.shipyard.ShipyardApplication#main} detecting "serve" in args, and {@link CliRunner}
 * skips picocli so the embedded server keeps the JVM alive. The banner is printed once
 * Tomcat is listening.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 shipyard serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Shipyard HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Shipyard server running on port " + port);
        System.out.println();
        System.out.println("  Stream:   http://localhost:" + port + "/api/chat/{projectId}/stream");
        System.out.println("  Health:   http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
