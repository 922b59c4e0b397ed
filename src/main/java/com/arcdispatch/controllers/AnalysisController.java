package com.arcdispatch.controllers;

import com.arcdispatch.AnalysisService;
import com.arcdispatch.AppLogger;
import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.AnalysisResult;
import com.arcdispatch.models.PersistenceStatus;
import com.arcdispatch.models.ReasoningLevel;
import com.arcdispatch.models.StreamEvent;
import com.arcdispatch.session.EventSubscription;
import com.arcdispatch.session.SessionNotFoundException;
import com.arcdispatch.session.SessionNotReadyException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.sse.SseClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * REST and SSE controller for analysis sessions.
 *
 * Endpoints:
 *   POST   /api/analysis                Start an analysis (returns the session id)
 *   GET    /api/analysis/{id}           Session diagnostics
 *   GET    /api/analysis/{id}/events    Server-sent event stream, replayed from the first event
 *   POST   /api/analysis/{id}/cancel    Cancel a running analysis
 *   GET    /api/analysis/{id}/result    Final result plus persistence status
 *   POST   /api/analysis/{id}/retry     Follow-up analysis on a finished session
 */
public class AnalysisController implements Controller {

    private static final long POLL_SECONDS = 15;

    private final AnalysisService analysisService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public AnalysisController(AnalysisService analysisService, ObjectMapper objectMapper) {
        this.analysisService = analysisService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/analysis", this::startAnalysis);
        app.get("/api/analysis/{id}", this::describe);
        app.sse("/api/analysis/{id}/events", this::streamEvents);
        app.post("/api/analysis/{id}/cancel", this::cancel);
        app.get("/api/analysis/{id}/result", this::getResult);
        app.post("/api/analysis/{id}/retry", this::retry);
    }

    /**
     * POST /api/analysis
     * Body: { "puzzleId": "...", "modelId": "...", "providerId": "...", "config": { ... } }
     */
    private void startAnalysis(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String puzzleId = requireText(body, "puzzleId");
            String modelId = requireText(body, "modelId");
            String providerId = requireText(body, "providerId");
            AnalysisConfig config = parseConfig(body.path("config"));

            String sessionId = analysisService.startAnalysis(puzzleId, modelId, providerId, config);
            ctx.status(201).json(Map.of("sessionId", sessionId, "state", "pending"));
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Malformed JSON body"));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.warn("[AnalysisController] Failed to start analysis: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * GET /api/analysis/{id}
     */
    private void describe(Context ctx) {
        try {
            ctx.json(analysisService.describe(ctx.pathParam("id")));
        } catch (SessionNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.warn("[AnalysisController] Failed to describe session: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * GET /api/analysis/{id}/events
     * Each event is sent with its wire type as the SSE event name and the event JSON as data.
     * The stream closes after the terminal event.
     */
    private void streamEvents(SseClient client) {
        String sessionId = client.ctx().pathParam("id");
        AtomicBoolean disconnected = new AtomicBoolean(false);
        client.onClose(() -> disconnected.set(true));

        try {
            EventSubscription subscription = analysisService.streamEvents(sessionId);
            while (!disconnected.get() && !subscription.isFinished()) {
                StreamEvent event = subscription.next(POLL_SECONDS, TimeUnit.SECONDS);
                if (event != null) {
                    client.sendEvent(event.getType().getWireName(), objectMapper.writeValueAsString(event));
                }
            }
        } catch (SessionNotFoundException e) {
            client.sendEvent("error", objectMapper.createObjectNode().put("error", e.getMessage()).toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[AnalysisController] Event stream for " + sessionId + " interrupted");
        } catch (JsonProcessingException e) {
            logger.error("[AnalysisController] Failed to encode event for " + sessionId + ": " + e.getMessage(), e);
        } finally {
            client.close();
        }
    }

    /**
     * POST /api/analysis/{id}/cancel
     */
    private void cancel(Context ctx) {
        String sessionId = ctx.pathParam("id");
        try {
            boolean cancelled = analysisService.cancelAnalysis(sessionId);
            ctx.json(Map.of("sessionId", sessionId, "cancelled", cancelled));
        } catch (SessionNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.warn("[AnalysisController] Failed to cancel " + sessionId + ": " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * GET /api/analysis/{id}/result
     */
    private void getResult(Context ctx) {
        String sessionId = ctx.pathParam("id");
        try {
            AnalysisResult result = analysisService.getResult(sessionId);
            PersistenceStatus persistence = analysisService.getPersistenceStatus(sessionId);
            ObjectNode response = objectMapper.createObjectNode();
            response.set("result", objectMapper.valueToTree(result));
            response.set("persistence", objectMapper.valueToTree(persistence));
            ctx.json(response);
        } catch (SessionNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (SessionNotReadyException e) {
            ctx.status(409).json(notReadyBody(e));
        } catch (Exception e) {
            logger.warn("[AnalysisController] Failed to read result for " + sessionId + ": " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/analysis/{id}/retry
     * Body: { "instruction": "..." } (optional)
     */
    private void retry(Context ctx) {
        String priorId = ctx.pathParam("id");
        try {
            String instruction = null;
            String raw = ctx.body();
            if (raw != null && !raw.isBlank()) {
                instruction = objectMapper.readTree(raw).path("instruction").asText(null);
            }
            String sessionId = analysisService.retryAnalysis(priorId, instruction);
            ctx.status(201).json(Map.of("sessionId", sessionId, "retryOf", priorId));
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Malformed JSON body"));
        } catch (SessionNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (SessionNotReadyException e) {
            ctx.status(409).json(notReadyBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.warn("[AnalysisController] Failed to retry " + priorId + ": " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * Reads the optional config object of a start request. Absent fields keep their defaults.
     */
    static AnalysisConfig parseConfig(JsonNode node) {
        AnalysisConfig.Builder builder = AnalysisConfig.builder();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return builder.build();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("config must be an object");
        }
        if (node.hasNonNull("temperature")) {
            builder.temperature(node.get("temperature").asDouble());
        }
        builder.promptTemplateId(node.path("promptTemplateId").asText(null));
        builder.customInstruction(node.path("customInstruction").asText(null));
        builder.reasoningEffort(ReasoningLevel.parse(node.path("reasoningEffort").asText(null)));
        builder.reasoningVerbosity(ReasoningLevel.parse(node.path("reasoningVerbosity").asText(null)));
        builder.reasoningSummary(node.path("reasoningSummary").asText(null));
        if (node.hasNonNull("omitGroundTruth")) {
            builder.omitGroundTruth(node.get("omitGroundTruth").asBoolean());
        }
        if (node.hasNonNull("maxContinuations")) {
            builder.maxContinuations(node.get("maxContinuations").asInt());
        }
        if (node.hasNonNull("maxOutputTokens")) {
            builder.maxOutputTokens(node.get("maxOutputTokens").asInt());
        }
        if (node.hasNonNull("timeoutMs")) {
            builder.timeoutMs(node.get("timeoutMs").asLong());
        }
        return builder.build();
    }

    static Map<String, Object> notReadyBody(SessionNotReadyException e) {
        Map<String, Object> body = new LinkedHashMap<>(Controller.errorBody(e));
        body.put("state", e.getState().wireName());
        return body;
    }

    private static String requireText(JsonNode body, String field) {
        String value = body.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }
}
