package com.arcdispatch.providers;

import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.ConversationTurn;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.StreamEvent;
import com.arcdispatch.models.TokenUsage;
import com.arcdispatch.providers.ServerSentEventReader.ServerSentEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Stateless Anthropic Messages protocol.
 */
public class AnthropicMessagesAdapter extends AbstractProviderAdapter {

    static final String API_VERSION = "2023-06-01";
    static final int DEFAULT_MAX_TOKENS = 16000;

    public AnthropicMessagesAdapter(ObjectMapper mapper, ProviderTransport transport, ProviderEndpointConfig endpoint) {
        super(mapper, transport, endpoint);
    }

    @Override
    public boolean supportsContinuation() {
        return false;
    }

    @Override
    protected ProviderTurn issueCall(ProviderCall call, StreamEventSink sink) throws IOException, InterruptedException {
        String url = normalizeBaseUrl("https://api.anthropic.com") + "/v1/messages";
        Map<String, String> headers = new HashMap<>();
        String apiKey = endpoint.resolveApiKey();
        if (apiKey != null) {
            headers.put("x-api-key", apiKey);
        }
        headers.put("anthropic-version", API_VERSION);

        StringBuilder text = new StringBuilder();
        long inputTokens = 0;
        long outputTokens = 0;
        String stopReason = null;
        try (TransportResponse response = send(url, headers, buildPayload(call), call)) {
            ServerSentEventReader reader = new ServerSentEventReader(response.getLines().iterator());
            ServerSentEvent event;
            while ((event = reader.next()) != null) {
                JsonNode data = parseJson(event.getData());
                String type = event.getEvent() != null ? event.getEvent() : data.path("type").asText("");
                switch (type) {
                    case "message_start": {
                        JsonNode usage = data.path("message").path("usage");
                        inputTokens = usage.path("input_tokens").asLong(0);
                        outputTokens = usage.path("output_tokens").asLong(0);
                        break;
                    }
                    case "content_block_delta": {
                        JsonNode delta = data.path("delta");
                        String deltaType = delta.path("type").asText("");
                        if ("text_delta".equals(deltaType)) {
                            String chunk = delta.path("text").asText("");
                            if (!chunk.isEmpty()) {
                                text.append(chunk);
                                sink.accept(StreamEvent.textDelta(chunk));
                            }
                        } else if ("thinking_delta".equals(deltaType)) {
                            String chunk = delta.path("thinking").asText("");
                            if (!chunk.isEmpty()) {
                                sink.accept(StreamEvent.reasoningDelta(chunk));
                            }
                        }
                        break;
                    }
                    case "message_delta":
                        stopReason = firstNonNull(text(data.path("delta").path("stop_reason")), stopReason);
                        if (data.path("usage").has("output_tokens")) {
                            outputTokens = data.path("usage").path("output_tokens").asLong(outputTokens);
                        }
                        break;
                    case "message_stop": {
                        TokenUsage usage = new TokenUsage(inputTokens, outputTokens, 0);
                        if ("max_tokens".equals(stopReason)) {
                            return ProviderTurn.truncated(text.toString(), usage, null, stopReason);
                        }
                        return ProviderTurn.complete(text.toString(), usage, null);
                    }
                    case "error":
                        throw failure(data.path("error"));
                    default:
                        break;
                }
            }
        }
        throw new ProviderException(ErrorKind.TRANSPORT, "Stream from " + getProviderName() + " ended before completion");
    }

    ObjectNode buildPayload(ProviderCall call) {
        AnalysisConfig config = call.getConfig();
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", call.getModelId());
        payload.put("stream", true);
        Integer maxOutputTokens = resolveMaxOutputTokens(call);
        payload.put("max_tokens", maxOutputTokens != null ? maxOutputTokens : DEFAULT_MAX_TOKENS);
        if (call.getInstructions() != null && !call.getInstructions().isBlank()) {
            payload.put("system", call.getInstructions());
        }
        ArrayNode messages = payload.putArray("messages");
        for (ConversationTurn turn : call.getTurns()) {
            ObjectNode msg = messages.addObject();
            msg.put("role", turn.getRole().wireName());
            msg.put("content", turn.getContent());
        }
        if (config.getTemperature() != null) {
            payload.put("temperature", config.getTemperature());
        }
        return payload;
    }

    private ProviderException failure(JsonNode error) {
        String type = error.path("type").asText("");
        String message = error.path("message").asText("Provider reported a failure");
        String detail = "Provider error" + (type.isEmpty() ? "" : " [" + type + "]") + ": " + message;
        if ("rate_limit_error".equals(type)) {
            return new ProviderException(ErrorKind.RATE_LIMITED, detail);
        }
        return new ProviderException(ErrorKind.TRANSPORT, detail);
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
