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
 * Stateless OpenAI-compatible Chat Completions protocol (OpenRouter, DeepSeek and friends).
 * The whole conversation is resent on every call.
 */
public class ChatCompletionsAdapter extends AbstractProviderAdapter {

    public ChatCompletionsAdapter(ObjectMapper mapper, ProviderTransport transport, ProviderEndpointConfig endpoint) {
        super(mapper, transport, endpoint);
    }

    @Override
    public boolean supportsContinuation() {
        return false;
    }

    @Override
    protected ProviderTurn issueCall(ProviderCall call, StreamEventSink sink) throws IOException, InterruptedException {
        String url = normalizeBaseUrl(defaultBaseUrl()) + "/v1/chat/completions";
        Map<String, String> headers = new HashMap<>();
        String apiKey = endpoint.resolveApiKey();
        if (apiKey != null) {
            headers.put("Authorization", "Bearer " + apiKey);
        }

        StringBuilder text = new StringBuilder();
        String finishReason = null;
        TokenUsage usage = TokenUsage.ZERO;
        boolean sawChunk = false;
        try (TransportResponse response = send(url, headers, buildPayload(call), call)) {
            ServerSentEventReader reader = new ServerSentEventReader(response.getLines().iterator());
            ServerSentEvent event;
            while ((event = reader.next()) != null) {
                JsonNode data = parseJson(event.getData());
                if (data.has("error")) {
                    throw failure(data.path("error"));
                }
                sawChunk = true;
                JsonNode choice = data.path("choices").path(0);
                JsonNode delta = choice.path("delta");
                String reasoning = firstText(delta, "reasoning_content", "reasoning");
                if (reasoning != null && !reasoning.isEmpty()) {
                    sink.accept(StreamEvent.reasoningDelta(reasoning));
                }
                String content = text(delta.path("content"));
                if (content != null && !content.isEmpty()) {
                    text.append(content);
                    sink.accept(StreamEvent.textDelta(content));
                }
                String reason = text(choice.path("finish_reason"));
                if (reason != null) {
                    finishReason = reason;
                }
                if (data.hasNonNull("usage")) {
                    usage = usage(data.path("usage"));
                }
            }
        }
        if (!sawChunk || finishReason == null) {
            throw new ProviderException(ErrorKind.TRANSPORT, "Stream from " + getProviderName() + " ended before completion");
        }
        if ("length".equals(finishReason)) {
            return ProviderTurn.truncated(text.toString(), usage, null, finishReason);
        }
        return ProviderTurn.complete(text.toString(), usage, null);
    }

    ObjectNode buildPayload(ProviderCall call) {
        AnalysisConfig config = call.getConfig();
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", call.getModelId());
        payload.put("stream", true);
        payload.putObject("stream_options").put("include_usage", true);

        ArrayNode messages = payload.putArray("messages");
        if (call.getInstructions() != null && !call.getInstructions().isBlank()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", call.getInstructions());
        }
        for (ConversationTurn turn : call.getTurns()) {
            ObjectNode msg = messages.addObject();
            msg.put("role", turn.getRole().wireName());
            msg.put("content", turn.getContent());
        }

        if (config.getTemperature() != null) {
            payload.put("temperature", config.getTemperature());
        }
        Integer maxOutputTokens = resolveMaxOutputTokens(call);
        if (maxOutputTokens != null) {
            payload.put("max_tokens", maxOutputTokens);
        }
        if (config.getReasoningEffort() != null) {
            payload.putObject("reasoning").put("effort", config.getReasoningEffort().wireName());
        }
        return payload;
    }

    private static TokenUsage usage(JsonNode usage) {
        return new TokenUsage(
            usage.path("prompt_tokens").asLong(0),
            usage.path("completion_tokens").asLong(0),
            usage.path("completion_tokens_details").path("reasoning_tokens").asLong(0));
    }

    private ProviderException failure(JsonNode error) {
        int code = error.path("code").asInt(0);
        String message = error.path("message").asText("Provider reported a failure");
        if (code == 429) {
            return new ProviderException(ErrorKind.RATE_LIMITED, "Provider error [429]: " + message, 429, null);
        }
        return new ProviderException(ErrorKind.TRANSPORT, "Provider error" + (code > 0 ? " [" + code + "]" : "") + ": " + message);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node.path(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String defaultBaseUrl() {
        String name = getProviderName() == null ? "" : getProviderName().toLowerCase();
        switch (name) {
            case "openrouter":
                return "https://openrouter.ai/api";
            case "deepseek":
                return "https://api.deepseek.com";
            default:
                return "http://localhost:1234";
        }
    }
}
