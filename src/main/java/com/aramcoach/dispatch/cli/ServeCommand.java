package com.aramcoach.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: aram-coach serve
 * <p>
 * Starts the HTTP server exposing the advice API. The web server is enabled
 * by {@link com.aramcoach.AramCoachApplication#main} detecting "serve" in the
 * arguments, and {@link CliRunner} skips picocli in that mode. The banner is
 * printed once the web server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the aram-coach HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("aram-coach server running on port " + port);
        System.out.println();
        System.out.println("  Pre-game:  POST http://localhost:" + port + "/api/v1/advice/pre-game");
        System.out.println("  In-game:   POST http://localhost:" + port + "/api/v1/advice/ingame");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
