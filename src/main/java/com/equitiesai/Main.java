package com.equitiesai;

import com.equitiesai.controllers.AiController;
import com.equitiesai.providers.ChatGateway;
import com.equitiesai.providers.ConfigurationException;
import com.equitiesai.providers.ProviderCatalog;
import com.equitiesai.settings.CredentialSet;
import com.equitiesai.settings.JsonFileCredentialStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            ProviderCatalog catalog = ProviderCatalog.loadDefault(objectMapper);
            CredentialSet credentials = new CredentialSet(
                new JsonFileCredentialStore(config.getCredentialsPath(), objectMapper));
            ChatGateway gateway = new ChatGateway(objectMapper, catalog, credentials);
            if (config.getProvider() != null) {
                gateway.configure(config.getProvider(), config.getModel());
            }
            logger.info("AI gateway ready: " + gateway.getProviderInfo().getProvider()
                + "/" + gateway.getProviderInfo().getModel());

            Javalin app = createApp(gateway);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Data directory: " + config.getDataPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Equities AI gateway: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Create the Javalin app with all routes and exception handlers registered.
     */
    public static Javalin createApp(ChatGateway gateway) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
        });
        new AiController(gateway, objectMapper).registerRoutes(app);
        registerExceptionHandlers(app);
        return app;
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(ConfigurationException.class, (e, ctx) -> {
            AppLogger.get().warn("Configuration error: " + e.getMessage());
            ctx.status(400).json(Map.of("error", e.getMessage(), "type", "configuration"));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger.get().error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Map.of("error", String.valueOf(e.getMessage())));
        });
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Equities AI Gateway v" + VERSION);
        if (config.isDevMode()) {
            logger.console("  (development mode)");
        }
        logger.console("========================================");
    }
}
