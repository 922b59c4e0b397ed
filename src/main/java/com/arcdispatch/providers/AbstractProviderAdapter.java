package com.arcdispatch.providers;

import com.arcdispatch.AppLogger;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.StreamEvent;
import com.arcdispatch.models.TokenUsage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared HTTP plumbing and the truncation loop. Subclasses implement {@link #issueCall}, which
 * performs one request and reports whether the provider cut the output short.
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    static final String CONTINUE_PROMPT = "Continue exactly where you left off. Do not repeat earlier output.";

    protected final ObjectMapper mapper;
    protected final ProviderTransport transport;
    protected final ProviderEndpointConfig endpoint;
    private final AppLogger logger = AppLogger.get();

    protected AbstractProviderAdapter(ObjectMapper mapper, ProviderTransport transport, ProviderEndpointConfig endpoint) {
        this.mapper = mapper;
        this.transport = transport;
        this.endpoint = endpoint;
    }

    @Override
    public String getProviderName() {
        return endpoint.getName();
    }

    @Override
    public final void stream(ProviderCall call, StreamEventSink sink) {
        sink.accept(StreamEvent.started());
        StringBuilder text = new StringBuilder();
        TokenUsage usage = TokenUsage.ZERO;
        ProviderCall current = call;
        int budget = call.getConfig().getMaxContinuations();
        int continuations = 0;
        try {
            while (true) {
                ProviderTurn turn = issueCall(current, sink);
                usage = usage.plus(turn.getUsage());
                text.append(turn.getText());
                if (!turn.isTruncated()) {
                    sink.accept(StreamEvent.completed(text.toString(), usage, turn.getContinuationHandle(), continuations));
                    return;
                }
                if (continuations >= budget) {
                    logWarning("Output still truncated after " + continuations + " continuation(s) for " + call.getModelId());
                    sink.accept(StreamEvent.error(ErrorKind.TRUNCATED_OUTPUT,
                        "Output truncated (" + reasonOf(turn) + ") after " + continuations + " continuation(s)"));
                    return;
                }
                continuations++;
                log("Output truncated (" + reasonOf(turn) + "), continuation " + continuations + "/" + budget
                    + " for " + call.getModelId());
                current = nextContinuation(current, turn);
            }
        } catch (ProviderException e) {
            logWarning(e.getKind().getWireName() + ": " + sanitize(e.getMessage()));
            sink.accept(StreamEvent.error(e.getKind(), sanitize(e.getMessage())));
        } catch (InterruptedException | InterruptedIOException e) {
            Thread.currentThread().interrupt();
            sink.accept(StreamEvent.cancelled());
        } catch (IOException | UncheckedIOException e) {
            logWarning("Transport failure: " + sanitize(e.getMessage()));
            sink.accept(StreamEvent.error(ErrorKind.TRANSPORT, "Transport failure: " + sanitize(describe(e))));
        } catch (RuntimeException e) {
            logError("Unexpected provider payload: " + sanitize(e.getMessage()), e);
            sink.accept(StreamEvent.error(ErrorKind.SCHEMA_VIOLATION, "Unexpected provider payload: " + sanitize(describe(e))));
        }
    }

    /**
     * Perform one request, forwarding text and reasoning deltas to {@code sink}.
     */
    protected abstract ProviderTurn issueCall(ProviderCall call, StreamEventSink sink)
        throws IOException, InterruptedException;

    /**
     * Call that picks up after a truncated turn: by handle when the provider holds state,
     * otherwise by resending the conversation with the partial answer appended.
     */
    protected ProviderCall nextContinuation(ProviderCall call, ProviderTurn truncated) {
        if (supportsContinuation() && truncated.getContinuationHandle() != null) {
            return call.continueFrom(truncated.getContinuationHandle(), CONTINUE_PROMPT);
        }
        return call.appendExchange(truncated.getText(), CONTINUE_PROMPT);
    }

    protected TransportResponse send(String url, Map<String, String> headers, JsonNode payload,
                                     ProviderCall call) throws IOException, InterruptedException {
        Map<String, String> allHeaders = new LinkedHashMap<>(endpoint.getExtraHeaders());
        allHeaders.putAll(headers);
        TransportRequest request = new TransportRequest(url, allHeaders, payload, resolveTimeout(call));
        if (logger.isDebugEnabled()) {
            logger.debug("[" + getClass().getSimpleName() + "] POST " + url + " model=" + call.getModelId()
                + (call.isContinuation() ? " continuing " + call.getPreviousHandle() : "")
                + " turns=" + call.getTurns().size());
        }
        TransportResponse response = transport.post(request);
        if (!response.isSuccess()) {
            String body;
            try (response) {
                body = response.readBody();
            }
            throw ProviderException.fromStatus(response.getStatusCode(), sanitize(body), call.isContinuation());
        }
        return response;
    }

    protected JsonNode parseJson(String data) throws ProviderException {
        try {
            return mapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorKind.SCHEMA_VIOLATION, "Unparseable stream payload from " + getProviderName(), e);
        }
    }

    protected Duration resolveTimeout(ProviderCall call) {
        Long timeoutMs = call.getConfig().getTimeoutMs();
        if (timeoutMs != null && timeoutMs > 0) {
            return Duration.ofMillis(timeoutMs);
        }
        return Duration.ofMillis(endpoint.getEffectiveTimeoutMs());
    }

    protected Integer resolveMaxOutputTokens(ProviderCall call) {
        Integer fromConfig = call.getConfig().getMaxOutputTokens();
        return fromConfig != null ? fromConfig : endpoint.getMaxOutputTokens();
    }

    /**
     * Normalize a base URL by removing trailing slashes and a trailing version segment.
     */
    protected String normalizeBaseUrl(String fallback) {
        String baseUrl = endpoint.getBaseUrl();
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }

    protected String sanitize(String text) {
        return CredentialSanitizer.sanitize(text, endpoint.resolveApiKey());
    }

    protected static String text(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String reasonOf(ProviderTurn turn) {
        return turn.getTruncationReason() != null ? turn.getTruncationReason() : "unknown";
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return m == null || m.isBlank() ? e.getClass().getSimpleName() : m;
    }

    protected void log(String message) {
        logger.info("[" + getClass().getSimpleName() + "] " + message);
    }

    protected void logWarning(String message) {
        logger.warn("[" + getClass().getSimpleName() + "] " + message);
    }

    private void logError(String message, Throwable t) {
        logger.error("[" + getClass().getSimpleName() + "] " + message, t);
    }
}
