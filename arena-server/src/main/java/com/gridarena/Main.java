package com.gridarena;

import com.gridarena.server.ArenaServer;
import com.gridarena.server.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the Grid Arena server.
 *
 * Usage: {@code java -jar arena-server.jar [port]}. The port argument
 * overrides the one in {@code arena-server.json}.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.load();

        if (args.length > 0) {
            int port;
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                port = -1;
            }
            if (port <= 0 || port > 65535) {
                logger.error("Invalid port number '{}'. Usage: arena-server [port]", args[0]);
                System.exit(1);
            }
            config = config.withPort(port);
        }

        logger.info("===========================================");
        logger.info("  Grid Arena Server");
        logger.info("  Starting on port {}", config.getPort());
        logger.info("===========================================");

        ArenaServer server = new ArenaServer(config);

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }
}
