package com.teamlens.dispatch.cli;

import com.teamlens.core.watch.WatchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: teamlens serve
 * <p>
 * Watches the team directories and serves the observer WebSocket and REST reads.
 * The web server is enabled by {@link com.teamlens.TeamlensApplication#main} detecting
 * "serve" in args, and {@link CliRunner} skips picocli in that mode. The banner is
 * printed once the embedded server is listening.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 teamlens serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Watch team directories and serve live updates")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:3847}")
    private int port;

    private final WatchProperties watchProperties;

    public ServeCommand(@Autowired(required = false) WatchProperties watchProperties) {
        this.watchProperties = watchProperties;
    }

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Teamlens server running on port " + port);
        System.out.println();
        if (watchProperties != null) {
            System.out.println("  Teams:      " + watchProperties.getTeamsRoot());
            System.out.println("  Tasks:      " + watchProperties.getTasksRoot());
        }
        System.out.println("  Observers:  ws://localhost:" + port + "/ws");
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
