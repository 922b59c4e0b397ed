package com.arcdispatch.models;

import java.util.List;

/**
 * Per-request configuration bag. Immutable; built through {@link Builder}.
 */
public final class AnalysisConfig {

    public static final String DEFAULT_TEMPLATE_ID = "solver";
    public static final int DEFAULT_MAX_CONTINUATIONS = 3;
    public static final List<String> REASONING_SUMMARIES = List.of("auto", "detailed", "none");

    private final Double temperature;
    private final String promptTemplateId;
    private final String customInstruction;
    private final ReasoningLevel reasoningEffort;
    private final ReasoningLevel reasoningVerbosity;
    private final String reasoningSummary;
    private final boolean omitGroundTruth;
    private final int maxContinuations;
    private final Integer maxOutputTokens;
    private final Long timeoutMs;

    private AnalysisConfig(Builder builder) {
        this.temperature = builder.temperature;
        this.promptTemplateId = builder.promptTemplateId;
        this.customInstruction = builder.customInstruction;
        this.reasoningEffort = builder.reasoningEffort;
        this.reasoningVerbosity = builder.reasoningVerbosity;
        this.reasoningSummary = builder.reasoningSummary;
        this.omitGroundTruth = builder.omitGroundTruth;
        this.maxContinuations = builder.maxContinuations;
        this.maxOutputTokens = builder.maxOutputTokens;
        this.timeoutMs = builder.timeoutMs;
    }

    public static AnalysisConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.temperature = temperature;
        b.promptTemplateId = promptTemplateId;
        b.customInstruction = customInstruction;
        b.reasoningEffort = reasoningEffort;
        b.reasoningVerbosity = reasoningVerbosity;
        b.reasoningSummary = reasoningSummary;
        b.omitGroundTruth = omitGroundTruth;
        b.maxContinuations = maxContinuations;
        b.maxOutputTokens = maxOutputTokens;
        b.timeoutMs = timeoutMs;
        return b;
    }

    public Double getTemperature() {
        return temperature;
    }

    public String getPromptTemplateId() {
        return promptTemplateId;
    }

    /**
     * Template actually used: the explicit id, or the default one when neither an id nor a
     * custom instruction was given.
     */
    public String getEffectiveTemplateId() {
        if (promptTemplateId != null) {
            return promptTemplateId;
        }
        return customInstruction != null ? null : DEFAULT_TEMPLATE_ID;
    }

    public String getCustomInstruction() {
        return customInstruction;
    }

    public ReasoningLevel getReasoningEffort() {
        return reasoningEffort;
    }

    public ReasoningLevel getReasoningVerbosity() {
        return reasoningVerbosity;
    }

    public String getReasoningSummary() {
        return reasoningSummary;
    }

    public boolean isOmitGroundTruth() {
        return omitGroundTruth;
    }

    public int getMaxContinuations() {
        return maxContinuations;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public static class Builder {
        private Double temperature;
        private String promptTemplateId;
        private String customInstruction;
        private ReasoningLevel reasoningEffort;
        private ReasoningLevel reasoningVerbosity;
        private String reasoningSummary;
        private boolean omitGroundTruth = false;
        private int maxContinuations = DEFAULT_MAX_CONTINUATIONS;
        private Integer maxOutputTokens;
        private Long timeoutMs;

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder promptTemplateId(String promptTemplateId) {
            this.promptTemplateId = blankToNull(promptTemplateId);
            return this;
        }

        public Builder customInstruction(String customInstruction) {
            this.customInstruction = blankToNull(customInstruction);
            return this;
        }

        public Builder reasoningEffort(ReasoningLevel reasoningEffort) {
            this.reasoningEffort = reasoningEffort;
            return this;
        }

        public Builder reasoningVerbosity(ReasoningLevel reasoningVerbosity) {
            this.reasoningVerbosity = reasoningVerbosity;
            return this;
        }

        public Builder reasoningSummary(String reasoningSummary) {
            String value = blankToNull(reasoningSummary);
            this.reasoningSummary = value != null ? value.toLowerCase() : null;
            return this;
        }

        public Builder omitGroundTruth(boolean omitGroundTruth) {
            this.omitGroundTruth = omitGroundTruth;
            return this;
        }

        public Builder maxContinuations(int maxContinuations) {
            this.maxContinuations = maxContinuations;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public AnalysisConfig build() {
            if (promptTemplateId != null && customInstruction != null) {
                throw new IllegalArgumentException("promptTemplateId and customInstruction are mutually exclusive");
            }
            if (maxContinuations < 0) {
                throw new IllegalArgumentException("maxContinuations must be >= 0");
            }
            if (timeoutMs != null && timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive");
            }
            if (maxOutputTokens != null && maxOutputTokens <= 0) {
                throw new IllegalArgumentException("maxOutputTokens must be positive");
            }
            if (reasoningSummary != null && !REASONING_SUMMARIES.contains(reasoningSummary)) {
                throw new IllegalArgumentException("reasoningSummary must be one of " + REASONING_SUMMARIES);
            }
            return new AnalysisConfig(this);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
