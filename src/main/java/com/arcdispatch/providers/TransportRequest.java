package com.arcdispatch.providers;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class TransportRequest {

    private final String url;
    private final Map<String, String> headers;
    private final JsonNode payload;
    private final Duration timeout;

    public TransportRequest(String url, Map<String, String> headers, JsonNode payload, Duration timeout) {
        this.url = url;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.payload = payload;
        this.timeout = timeout;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
