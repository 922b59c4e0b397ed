package com.arcdispatch.models;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a caller asked for: one puzzle, one model on one provider, one configuration.
 * Retries carry the continuation data needed to resume a prior conversation.
 * Never mutated after construction.
 */
public final class AnalysisRequest {

    private final String puzzleId;
    private final String modelId;
    private final String providerId;
    private final AnalysisConfig config;
    private final String continuationHandle;
    private final String followUpInstruction;
    private final List<ConversationTurn> priorTurns;
    private final String retryOf;
    private final AnalysisRequest freshFallback;

    private AnalysisRequest(Builder builder) {
        this.puzzleId = requireText(builder.puzzleId, "puzzleId");
        this.modelId = requireText(builder.modelId, "modelId");
        this.providerId = requireText(builder.providerId, "providerId");
        this.config = builder.config != null ? builder.config : AnalysisConfig.defaults();
        this.continuationHandle = builder.continuationHandle;
        this.followUpInstruction = builder.followUpInstruction;
        this.priorTurns = builder.priorTurns == null
            ? Collections.emptyList()
            : List.copyOf(builder.priorTurns);
        this.retryOf = builder.retryOf;
        this.freshFallback = builder.freshFallback;
    }

    public static AnalysisRequest of(String puzzleId, String modelId, String providerId, AnalysisConfig config) {
        return builder().puzzleId(puzzleId).modelId(modelId).providerId(providerId).config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder seeded with this request's identity and configuration, without any continuation data.
     */
    public Builder toFreshBuilder() {
        return builder().puzzleId(puzzleId).modelId(modelId).providerId(providerId).config(config);
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

    public AnalysisConfig getConfig() {
        return config;
    }

    public String getContinuationHandle() {
        return continuationHandle;
    }

    public boolean hasContinuationHandle() {
        return continuationHandle != null && !continuationHandle.isBlank();
    }

    public String getFollowUpInstruction() {
        return followUpInstruction;
    }

    public List<ConversationTurn> getPriorTurns() {
        return priorTurns;
    }

    public String getRetryOf() {
        return retryOf;
    }

    /**
     * Request to run instead when the continuation handle of this one is rejected.
     */
    public AnalysisRequest getFreshFallback() {
        return freshFallback;
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value.trim();
    }

    public static class Builder {
        private String puzzleId;
        private String modelId;
        private String providerId;
        private AnalysisConfig config;
        private String continuationHandle;
        private String followUpInstruction;
        private List<ConversationTurn> priorTurns;
        private String retryOf;
        private AnalysisRequest freshFallback;

        public Builder puzzleId(String puzzleId) {
            this.puzzleId = puzzleId;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder config(AnalysisConfig config) {
            this.config = config;
            return this;
        }

        public Builder continuationHandle(String continuationHandle) {
            this.continuationHandle = continuationHandle;
            return this;
        }

        public Builder followUpInstruction(String followUpInstruction) {
            this.followUpInstruction = followUpInstruction;
            return this;
        }

        public Builder priorTurns(List<ConversationTurn> priorTurns) {
            this.priorTurns = priorTurns;
            return this;
        }

        public Builder retryOf(String retryOf) {
            this.retryOf = retryOf;
            return this;
        }

        public Builder freshFallback(AnalysisRequest freshFallback) {
            this.freshFallback = freshFallback;
            return this;
        }

        public AnalysisRequest build() {
            return new AnalysisRequest(this);
        }
    }
}
