package com.arcdispatch;

import com.arcdispatch.coordinator.ProviderSlotCoordinator;
import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.AnalysisRequest;
import com.arcdispatch.models.AnalysisResult;
import com.arcdispatch.models.PersistenceStatus;
import com.arcdispatch.providers.ProviderAdapterFactory;
import com.arcdispatch.retry.RetryController;
import com.arcdispatch.session.EventSubscription;
import com.arcdispatch.session.SessionSnapshot;
import com.arcdispatch.session.StreamSessionManager;

/**
 * Entry point for callers: start, observe, cancel, fetch and retry analyses.
 */
public class AnalysisService {

    private final StreamSessionManager sessionManager;
    private final RetryController retryController;
    private final ProviderSlotCoordinator coordinator;

    public AnalysisService(StreamSessionManager sessionManager, RetryController retryController,
                           ProviderSlotCoordinator coordinator) {
        this.sessionManager = sessionManager;
        this.retryController = retryController;
        this.coordinator = coordinator;
    }

    /**
     * Returns immediately with the new session id; the analysis runs in the background.
     */
    public String startAnalysis(String puzzleId, String modelId, String providerId, AnalysisConfig config) {
        return sessionManager.open(AnalysisRequest.of(puzzleId, modelId, providerId, config));
    }

    public EventSubscription streamEvents(String sessionId) {
        return sessionManager.subscribe(sessionId);
    }

    public boolean cancelAnalysis(String sessionId) {
        return sessionManager.cancel(sessionId);
    }

    public AnalysisResult getResult(String sessionId) {
        return sessionManager.getResult(sessionId);
    }

    public PersistenceStatus getPersistenceStatus(String sessionId) {
        return sessionManager.getPersistenceStatus(sessionId);
    }

    public String retryAnalysis(String priorSessionId, String extraInstruction) {
        return retryController.retry(priorSessionId, extraInstruction);
    }

    public SessionSnapshot describe(String sessionId) {
        return sessionManager.require(sessionId).snapshot();
    }

    public ProviderAdapterFactory getAdapters() {
        return sessionManager.getAdapters();
    }

    public ProviderSlotCoordinator getCoordinator() {
        return coordinator;
    }
}
