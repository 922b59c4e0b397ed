package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;

/**
 * Terminal snapshot of one session. Built once by the session manager and never modified.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisResult {

    private final String sessionId;
    private final String puzzleId;
    private final String modelId;
    private final String providerId;
    private final SessionState state;
    private final String rawText;
    private final String reasoningText;
    private final List<int[][]> predictedGrids;
    private final PredictionValidation validation;
    private final AnswerDetails answerDetails;
    private final TokenUsage usage;
    private final String continuationHandle;
    private final int continuationCount;
    private final ErrorKind errorKind;
    private final String errorMessage;
    private final String retryOf;
    private final long createdAt;
    private final Long completedAt;
    private final Long apiProcessingTimeMs;

    private AnalysisResult(Builder b) {
        this.sessionId = b.sessionId;
        this.puzzleId = b.puzzleId;
        this.modelId = b.modelId;
        this.providerId = b.providerId;
        this.state = b.state;
        this.rawText = b.rawText;
        this.reasoningText = b.reasoningText;
        this.predictedGrids = b.predictedGrids != null
            ? Collections.unmodifiableList(b.predictedGrids)
            : Collections.emptyList();
        this.validation = b.validation;
        this.answerDetails = b.answerDetails != null && !b.answerDetails.isEmpty() ? b.answerDetails : null;
        this.usage = b.usage != null ? b.usage : TokenUsage.ZERO;
        this.continuationHandle = b.continuationHandle;
        this.continuationCount = b.continuationCount;
        this.errorKind = b.errorKind;
        this.errorMessage = b.errorMessage;
        this.retryOf = b.retryOf;
        this.createdAt = b.createdAt;
        this.completedAt = b.completedAt;
        this.apiProcessingTimeMs = b.apiProcessingTimeMs;
    }

    public static Builder builder() {
        return new Builder();
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

    public SessionState getState() {
        return state;
    }

    public String getRawText() {
        return rawText;
    }

    public String getReasoningText() {
        return reasoningText;
    }

    public List<int[][]> getPredictedGrids() {
        return predictedGrids;
    }

    public PredictionValidation getValidation() {
        return validation;
    }

    /** Pattern description, strategy, hints and confidence from a structured answer; null if absent. */
    public AnswerDetails getAnswerDetails() {
        return answerDetails;
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public String getContinuationHandle() {
        return continuationHandle;
    }

    public int getContinuationCount() {
        return continuationCount;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getRetryOf() {
        return retryOf;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public Long getCompletedAt() {
        return completedAt;
    }

    public Long getApiProcessingTimeMs() {
        return apiProcessingTimeMs;
    }

    public static class Builder {
        private String sessionId;
        private String puzzleId;
        private String modelId;
        private String providerId;
        private SessionState state;
        private String rawText;
        private String reasoningText;
        private List<int[][]> predictedGrids;
        private PredictionValidation validation;
        private AnswerDetails answerDetails;
        private TokenUsage usage;
        private String continuationHandle;
        private int continuationCount;
        private ErrorKind errorKind;
        private String errorMessage;
        private String retryOf;
        private long createdAt;
        private Long completedAt;
        private Long apiProcessingTimeMs;

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder request(AnalysisRequest request) {
            this.puzzleId = request.getPuzzleId();
            this.modelId = request.getModelId();
            this.providerId = request.getProviderId();
            this.retryOf = request.getRetryOf();
            return this;
        }

        public Builder state(SessionState state) {
            this.state = state;
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder reasoningText(String reasoningText) {
            this.reasoningText = reasoningText;
            return this;
        }

        public Builder predictedGrids(List<int[][]> predictedGrids) {
            this.predictedGrids = predictedGrids;
            return this;
        }

        public Builder validation(PredictionValidation validation) {
            this.validation = validation;
            if (validation != null) {
                this.predictedGrids = validation.getPredictedGrids();
            }
            return this;
        }

        public Builder answerDetails(AnswerDetails answerDetails) {
            this.answerDetails = answerDetails;
            return this;
        }

        public Builder usage(TokenUsage usage) {
            this.usage = usage;
            return this;
        }

        public Builder continuationHandle(String continuationHandle) {
            this.continuationHandle = continuationHandle;
            return this;
        }

        public Builder continuationCount(int continuationCount) {
            this.continuationCount = continuationCount;
            return this;
        }

        public Builder error(ErrorKind errorKind, String errorMessage) {
            this.errorKind = errorKind;
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder completedAt(Long completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder apiProcessingTimeMs(Long apiProcessingTimeMs) {
            this.apiProcessingTimeMs = apiProcessingTimeMs;
            return this;
        }

        public AnalysisResult build() {
            return new AnalysisResult(this);
        }
    }
}
