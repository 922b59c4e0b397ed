package com.arcdispatch.providers;

/**
 * Normalizes one provider protocol into {@link com.arcdispatch.models.StreamEvent}s.
 */
public interface ProviderAdapter {

    String getProviderName();

    /**
     * True when the provider keeps conversation state and hands out continuation handles.
     */
    boolean supportsContinuation();

    /**
     * Run the call, emitting events into {@code sink}. Always ends with exactly one terminal
     * event (completed, error or cancelled) and never throws.
     */
    void stream(ProviderCall call, StreamEventSink sink);
}
