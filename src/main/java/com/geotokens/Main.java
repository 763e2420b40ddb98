package com.geotokens;

import com.geotokens.agent.ActionQueue;
import com.geotokens.agent.GameServer;
import com.geotokens.core.GameLoop;
import com.geotokens.core.GameWorld;
import com.geotokens.input.MovementKeys;
import com.geotokens.save.SaveManager;
import com.geotokens.world.GameConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for GeoTokens.
 * <p>
 * Usage:
 *   java -jar geotokens.jar                          # default session, port from config
 *   java -jar geotokens.jar --config my.properties   # override configuration
 *   java -jar geotokens.jar --session walk2 --port 25570
 *   java -jar geotokens.jar --save-dir /tmp/saves    # keep sessions elsewhere
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        initLogging();

        String configPath = null;
        String sessionName = "default";
        String saveDir = null;
        Integer port = null;

        // Parse command-line arguments
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> {
                    if (i + 1 < args.length) configPath = args[++i];
                }
                case "--session" -> {
                    if (i + 1 < args.length) sessionName = args[++i];
                }
                case "--save-dir" -> {
                    if (i + 1 < args.length) saveDir = args[++i];
                }
                case "--port" -> {
                    if (i + 1 < args.length) {
                        try {
                            port = Integer.parseInt(args[++i]);
                        } catch (NumberFormatException e) {
                            System.err.println("Invalid port: " + args[i]);
                            System.exit(2);
                        }
                    }
                }
                default -> System.err.println("Unknown argument: " + args[i]);
            }
        }

        if (!SaveManager.isValidSessionName(sessionName)) {
            System.err.println("Invalid session name: " + sessionName + " (letters, digits, '-' and '_' only)");
            System.exit(2);
        }

        GameConfig config;
        if (configPath != null) {
            try {
                config = GameConfig.load(Paths.get(configPath));
            } catch (IOException | IllegalArgumentException e) {
                System.err.println("Cannot read config " + configPath + ": " + e.getMessage());
                System.exit(2);
                return;
            }
        } else {
            config = GameConfig.loadDefault();
        }
        if (port != null) config.serverPort = port;

        GameWorld world = new GameWorld(config);
        SaveManager saveManager = saveDir != null
            ? new SaveManager(Path.of(saveDir), sessionName)
            : new SaveManager(sessionName);

        ActionQueue actions = new ActionQueue();
        GameServer server = new GameServer(config, actions);
        world.addListener(server);

        // load() falls back to a fresh start and loads the initial view either way
        saveManager.load(world);

        GameLoop loop = new GameLoop(world, actions, saveManager, new MovementKeys());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loop.stop();
            try {
                saveManager.save(world);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to save session on shutdown", e);
            }
            server.shutdown();
        }, "Shutdown"));

        server.start();
        loop.start();
        LOG.info("GeoTokens running: session '" + sessionName + "', " +
                 world.getCells().liveCount() + " cells in view");

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void initLogging() {
        try (InputStream is = Main.class.getResourceAsStream("/logging.properties")) {
            if (is != null) LogManager.getLogManager().readConfiguration(is);
        } catch (IOException e) {
            System.err.println("Failed to read logging.properties: " + e.getMessage());
        }
    }
}
