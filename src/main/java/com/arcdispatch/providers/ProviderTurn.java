package com.arcdispatch.providers;

import com.arcdispatch.models.TokenUsage;

/**
 * Outcome of a single provider call before any auto-continuation.
 */
public final class ProviderTurn {

    private final String text;
    private final TokenUsage usage;
    private final String continuationHandle;
    private final boolean truncated;
    private final String truncationReason;

    public ProviderTurn(String text, TokenUsage usage, String continuationHandle,
                        boolean truncated, String truncationReason) {
        this.text = text != null ? text : "";
        this.usage = usage != null ? usage : TokenUsage.ZERO;
        this.continuationHandle = continuationHandle;
        this.truncated = truncated;
        this.truncationReason = truncationReason;
    }

    public static ProviderTurn complete(String text, TokenUsage usage, String continuationHandle) {
        return new ProviderTurn(text, usage, continuationHandle, false, null);
    }

    public static ProviderTurn truncated(String text, TokenUsage usage, String continuationHandle, String reason) {
        return new ProviderTurn(text, usage, continuationHandle, true, reason);
    }

    public String getText() {
        return text;
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public String getContinuationHandle() {
        return continuationHandle;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public String getTruncationReason() {
        return truncationReason;
    }
}
