package com.arcdispatch.providers;

import com.arcdispatch.models.StreamEvent;

@FunctionalInterface
public interface StreamEventSink {
    void accept(StreamEvent event);
}
