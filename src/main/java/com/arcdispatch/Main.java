package com.arcdispatch;

import com.arcdispatch.collaborators.FilePuzzleCatalog;
import com.arcdispatch.collaborators.JsonFileResultStore;
import com.arcdispatch.collaborators.TemplatePromptBuilder;
import com.arcdispatch.controllers.AnalysisController;
import com.arcdispatch.controllers.Controller;
import com.arcdispatch.controllers.ProviderController;
import com.arcdispatch.coordinator.ProviderSlotCoordinator;
import com.arcdispatch.providers.HttpProviderTransport;
import com.arcdispatch.providers.ProviderAdapterFactory;
import com.arcdispatch.providers.ProviderEndpointConfig;
import com.arcdispatch.providers.ProviderSettings;
import com.arcdispatch.retry.RetryController;
import com.arcdispatch.session.SessionNotFoundException;
import com.arcdispatch.session.SessionNotReadyException;
import com.arcdispatch.session.StreamSessionManager;
import com.arcdispatch.validation.PredictionValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

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

            ProviderSettings settings = ProviderSettings.load(config.getProvidersFile(), objectMapper);
            logger.info("Loaded " + settings.all().size() + " provider endpoint(s)");

            ProviderSlotCoordinator coordinator = new ProviderSlotCoordinator(providerId -> {
                ProviderEndpointConfig endpoint = settings.find(providerId);
                return endpoint != null ? endpoint.getEffectiveMaxConcurrent() : ProviderSlotCoordinator.DEFAULT_PERMITS;
            });
            ProviderAdapterFactory adapters = new ProviderAdapterFactory(
                    objectMapper, new HttpProviderTransport(objectMapper), settings);

            StreamSessionManager sessionManager = new StreamSessionManager(
                    adapters,
                    coordinator,
                    new FilePuzzleCatalog(config.getPuzzlesPath(), objectMapper),
                    new TemplatePromptBuilder(),
                    new PredictionValidator(objectMapper),
                    new JsonFileResultStore(config.getDataPath(), objectMapper),
                    Duration.ofMinutes(config.getRetentionMinutes()),
                    Clock.systemUTC());
            sessionManager.start();

            AnalysisService analysisService = new AnalysisService(
                    sessionManager, new RetryController(sessionManager), coordinator);

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                    new AnalysisController(analysisService, objectMapper),
                    new ProviderController(analysisService, objectMapper));
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Puzzles: " + config.getPuzzlesPath());
            logger.console("  Results: " + config.getDataPath().resolve("results"));
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                sessionManager.shutdown();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start ARC Dispatch: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  ARC Dispatch v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        logger.console("  Session retention: " + config.getRetentionMinutes() + " min");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(SessionNotFoundException.class, (e, ctx) -> {
            logger.warn("Session not found: " + e.getSessionId());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(SessionNotReadyException.class, (e, ctx) -> {
            ctx.status(409).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
