package com.arcdispatch.models;

/**
 * Token counters for one provider call, or the running total of a session.
 * Totals across auto-continuations are cumulative.
 */
public final class TokenUsage {

    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0);

    private final long inputTokens;
    private final long outputTokens;
    private final long reasoningTokens;

    public TokenUsage(long inputTokens, long outputTokens, long reasoningTokens) {
        this.inputTokens = Math.max(0, inputTokens);
        this.outputTokens = Math.max(0, outputTokens);
        this.reasoningTokens = Math.max(0, reasoningTokens);
    }

    public long getInputTokens() {
        return inputTokens;
    }

    public long getOutputTokens() {
        return outputTokens;
    }

    public long getReasoningTokens() {
        return reasoningTokens;
    }

    /**
     * Input plus output. Reasoning tokens are a breakdown of output and are not added again.
     */
    public long getTotalTokens() {
        return inputTokens + outputTokens;
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(inputTokens + other.inputTokens,
            outputTokens + other.outputTokens,
            reasoningTokens + other.reasoningTokens);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenUsage)) return false;
        TokenUsage that = (TokenUsage) o;
        return inputTokens == that.inputTokens
            && outputTokens == that.outputTokens
            && reasoningTokens == that.reasoningTokens;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(inputTokens) * 31 * 31 + Long.hashCode(outputTokens) * 31 + Long.hashCode(reasoningTokens);
    }

    @Override
    public String toString() {
        return "in=" + inputTokens + ", out=" + outputTokens + ", reasoning=" + reasoningTokens;
    }
}
