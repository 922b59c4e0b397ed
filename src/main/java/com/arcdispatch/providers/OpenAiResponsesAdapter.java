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
 * Stateful "Responses" protocol (OpenAI, xAI). Each response carries an id that later calls
 * pass back as {@code previous_response_id}.
 */
public class OpenAiResponsesAdapter extends AbstractProviderAdapter {

    public OpenAiResponsesAdapter(ObjectMapper mapper, ProviderTransport transport, ProviderEndpointConfig endpoint) {
        super(mapper, transport, endpoint);
    }

    @Override
    public boolean supportsContinuation() {
        return true;
    }

    @Override
    protected ProviderTurn issueCall(ProviderCall call, StreamEventSink sink) throws IOException, InterruptedException {
        String url = normalizeBaseUrl(defaultBaseUrl()) + "/v1/responses";
        Map<String, String> headers = new HashMap<>();
        String apiKey = endpoint.resolveApiKey();
        if (apiKey != null) {
            headers.put("Authorization", "Bearer " + apiKey);
        }

        StringBuilder text = new StringBuilder();
        String responseId = null;
        try (TransportResponse response = send(url, headers, buildPayload(call), call)) {
            ServerSentEventReader reader = new ServerSentEventReader(response.getLines().iterator());
            ServerSentEvent event;
            while ((event = reader.next()) != null) {
                JsonNode data = parseJson(event.getData());
                String type = event.getEvent() != null ? event.getEvent() : data.path("type").asText("");
                switch (type) {
                    case "response.created":
                    case "response.in_progress":
                        responseId = firstNonNull(text(data.path("response").path("id")), responseId);
                        break;
                    case "response.output_text.delta": {
                        String delta = data.path("delta").asText("");
                        if (!delta.isEmpty()) {
                            text.append(delta);
                            sink.accept(StreamEvent.textDelta(delta));
                        }
                        break;
                    }
                    case "response.reasoning_summary_text.delta":
                    case "response.reasoning_text.delta": {
                        String delta = data.path("delta").asText("");
                        if (!delta.isEmpty()) {
                            sink.accept(StreamEvent.reasoningDelta(delta));
                        }
                        break;
                    }
                    case "response.completed":
                    case "response.incomplete":
                        return finish(data.path("response"), text, responseId);
                    case "response.failed":
                        throw failure(data.path("response").path("error"), call);
                    case "error":
                        throw failure(data.has("error") ? data.path("error") : data, call);
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
        payload.put("store", true);
        if (call.getInstructions() != null && !call.getInstructions().isBlank()) {
            payload.put("instructions", call.getInstructions());
        }
        ArrayNode input = payload.putArray("input");
        for (ConversationTurn turn : call.getTurns()) {
            ObjectNode message = input.addObject();
            message.put("role", turn.getRole().wireName());
            message.put("content", turn.getContent());
        }
        if (call.isContinuation()) {
            payload.put("previous_response_id", call.getPreviousHandle());
        }

        Integer maxOutputTokens = resolveMaxOutputTokens(call);
        if (maxOutputTokens != null) {
            payload.put("max_output_tokens", maxOutputTokens);
        }
        if (config.getReasoningEffort() != null || config.getReasoningSummary() != null) {
            ObjectNode reasoning = payload.putObject("reasoning");
            if (config.getReasoningEffort() != null) {
                reasoning.put("effort", config.getReasoningEffort().wireName());
            }
            if (config.getReasoningSummary() != null && !"none".equalsIgnoreCase(config.getReasoningSummary())) {
                reasoning.put("summary", config.getReasoningSummary());
            }
        } else if (config.getTemperature() != null) {
            // reasoning models reject temperature
            payload.put("temperature", config.getTemperature());
        }

        ObjectNode textNode = payload.putObject("text");
        if (config.getReasoningVerbosity() != null) {
            textNode.put("verbosity", config.getReasoningVerbosity().wireName());
        }
        textNode.set("format", ResponseSchemas.responseFormat(mapper, call.getTestCount()));
        return payload;
    }

    private ProviderTurn finish(JsonNode response, StringBuilder streamed, String responseId) {
        String id = firstNonNull(text(response.path("id")), responseId);
        String text = streamed.length() > 0 ? streamed.toString() : outputText(response);
        TokenUsage usage = usage(response.path("usage"));
        String status = response.path("status").asText("");
        String reason = text(response.path("incomplete_details").path("reason"));
        if ("incomplete".equals(status) || reason != null) {
            return ProviderTurn.truncated(text, usage, id, reason);
        }
        return ProviderTurn.complete(text, usage, id);
    }

    private String outputText(JsonNode response) {
        String direct = text(response.path("output_text"));
        if (direct != null) {
            return direct;
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode item : response.path("output")) {
            if (!"message".equals(item.path("type").asText())) {
                continue;
            }
            for (JsonNode content : item.path("content")) {
                if ("output_text".equals(content.path("type").asText())) {
                    sb.append(content.path("text").asText(""));
                }
            }
        }
        return sb.toString();
    }

    static TokenUsage usage(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return TokenUsage.ZERO;
        }
        return new TokenUsage(
            usage.path("input_tokens").asLong(0),
            usage.path("output_tokens").asLong(0),
            usage.path("output_tokens_details").path("reasoning_tokens").asLong(0));
    }

    private ProviderException failure(JsonNode error, ProviderCall call) {
        String code = error.path("code").asText("");
        String message = error.path("message").asText("Provider reported a failure");
        String detail = "Provider error" + (code.isEmpty() ? "" : " [" + code + "]") + ": " + message;
        if ("rate_limit_exceeded".equals(code)) {
            return new ProviderException(ErrorKind.RATE_LIMITED, detail);
        }
        if (call.isContinuation() && ProviderException.mentionsContinuation(code + " " + message)) {
            return new ProviderException(ErrorKind.CONTINUATION_REJECTED, detail);
        }
        return new ProviderException(ErrorKind.TRANSPORT, detail);
    }

    private String defaultBaseUrl() {
        String name = getProviderName() == null ? "" : getProviderName().toLowerCase();
        switch (name) {
            case "xai":
            case "grok":
                return "https://api.x.ai";
            case "openai":
            default:
                return "https://api.openai.com";
        }
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
