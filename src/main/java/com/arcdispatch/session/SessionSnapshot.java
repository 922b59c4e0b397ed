package com.arcdispatch.session;

import com.arcdispatch.models.AnalysisRequest;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.PersistenceStatus;
import com.arcdispatch.models.SessionState;
import com.arcdispatch.models.TokenUsage;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Point-in-time view of a session for diagnostics. Available in every state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SessionSnapshot {

    private final String sessionId;
    private final String puzzleId;
    private final String modelId;
    private final String providerId;
    private final String retryOf;
    private final SessionState state;
    private final int textLength;
    private final int reasoningLength;
    private final int eventCount;
    private final TokenUsage usage;
    private final boolean hasContinuationHandle;
    private final long createdAt;
    private final Long terminalAt;
    private final ErrorKind errorKind;
    private final String errorMessage;
    private final PersistenceStatus persistence;

    SessionSnapshot(String sessionId, AnalysisRequest request, SessionState state, int textLength,
                    int reasoningLength, int eventCount, TokenUsage usage, boolean hasContinuationHandle,
                    long createdAt, long terminalAt, ErrorKind errorKind, String errorMessage,
                    PersistenceStatus persistence) {
        this.sessionId = sessionId;
        this.puzzleId = request.getPuzzleId();
        this.modelId = request.getModelId();
        this.providerId = request.getProviderId();
        this.retryOf = request.getRetryOf();
        this.state = state;
        this.textLength = textLength;
        this.reasoningLength = reasoningLength;
        this.eventCount = eventCount;
        this.usage = usage;
        this.hasContinuationHandle = hasContinuationHandle;
        this.createdAt = createdAt;
        this.terminalAt = terminalAt > 0 ? terminalAt : null;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.persistence = persistence;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getPuzzleId() {
        return puzzleId;
    }

    public String getModelId() {
        return modelId;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getRetryOf() {
        return retryOf;
    }

    public SessionState getState() {
        return state;
    }

    public int getTextLength() {
        return textLength;
    }

    public int getReasoningLength() {
        return reasoningLength;
    }

    public int getEventCount() {
        return eventCount;
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public boolean isHasContinuationHandle() {
        return hasContinuationHandle;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public Long getTerminalAt() {
        return terminalAt;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public PersistenceStatus getPersistence() {
        return persistence;
    }
}
