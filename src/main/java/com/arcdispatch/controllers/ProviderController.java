package com.arcdispatch.controllers;

import com.arcdispatch.AnalysisService;
import com.arcdispatch.AppLogger;
import com.arcdispatch.coordinator.ProviderSlotCoordinator;
import com.arcdispatch.providers.ProviderAdapter;
import com.arcdispatch.providers.ProviderEndpointConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * GET /api/providers: configured endpoints with their admission state.
 */
public class ProviderController implements Controller {

    private final AnalysisService analysisService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public ProviderController(AnalysisService analysisService, ObjectMapper objectMapper) {
        this.analysisService = analysisService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/providers", this::listProviders);
    }

    private void listProviders(Context ctx) {
        try {
            ProviderSlotCoordinator coordinator = analysisService.getCoordinator();
            ArrayNode result = objectMapper.createArrayNode();
            for (ProviderEndpointConfig config : analysisService.getAdapters().getSettings().all()) {
                ProviderAdapter adapter = analysisService.getAdapters().getAdapter(config.getName());
                ObjectNode node = result.addObject();
                node.put("name", config.getName());
                node.put("protocol", config.getProtocol());
                node.put("supportsContinuation", adapter.supportsContinuation());
                // Only whether a key is present; never the key.
                node.put("apiKeyConfigured", config.resolveApiKey() != null);
                node.put("permits", coordinator.getPermits(config.getName()));
                node.put("inFlight", coordinator.getInFlight(config.getName()));
                node.put("waiting", coordinator.getWaiting(config.getName()));
            }
            ctx.json(result);
        } catch (Exception e) {
            logger.warn("[ProviderController] Failed to list providers: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
