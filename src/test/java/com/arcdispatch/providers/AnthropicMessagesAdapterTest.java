package com.arcdispatch.providers;

import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.ConversationTurn;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.StreamEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.arcdispatch.providers.ScriptedTransport.concat;
import static com.arcdispatch.providers.ScriptedTransport.sse;
import static org.junit.jupiter.api.Assertions.*;

class AnthropicMessagesAdapterTest {

    private final ScriptedTransport transport = new ScriptedTransport();

    private AnthropicMessagesAdapter adapter() {
        ProviderEndpointConfig endpoint = new ProviderEndpointConfig("anthropic", "anthropic", "http://localhost:9");
        endpoint.setApiKeyEnv("ANTHROPIC_API_KEY");
        endpoint.setEnvironment(name -> "sk-ant-test-000000000");
        return new AnthropicMessagesAdapter(new ObjectMapper(), transport, endpoint);
    }

    private static ProviderCall call(AnalysisConfig config) {
        return new ProviderCall("claude-test", config, "system text",
            List.of(ConversationTurn.user("puzzle prompt")), null, 1);
    }

    private static List<String> message(String text, String stopReason, int input, int output) {
        return concat(
            sse("message_start", "{\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":" + input + ",\"output_tokens\":1}}}"),
            sse("content_block_delta", "{\"type\":\"content_block_delta\",\"delta\":{\"type\":\"thinking_delta\",\"thinking\":\"consider\"}}"),
            sse("content_block_delta", "{\"type\":\"content_block_delta\",\"delta\":{\"type\":\"text_delta\",\"text\":\"" + text + "\"}}"),
            sse("ping", "{\"type\":\"ping\"}"),
            sse("message_delta", "{\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"" + stopReason + "\"},\"usage\":{\"output_tokens\":" + output + "}}"),
            sse("message_stop", "{\"type\":\"message_stop\"}"));
    }

    @Test
    void streamsMessage() {
        transport.respond(200, message("grid", "end_turn", 50, 25));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        assertEquals(List.of(StreamEvent.Type.STARTED, StreamEvent.Type.REASONING_DELTA,
            StreamEvent.Type.TEXT_DELTA, StreamEvent.Type.COMPLETED), sink.types());
        assertEquals("grid", sink.last().getText());
        assertEquals(50, sink.last().getUsage().getInputTokens());
        assertEquals(25, sink.last().getUsage().getOutputTokens());

        TransportRequest request = transport.getRequests().get(0);
        assertEquals("http://localhost:9/v1/messages", request.getUrl());
        assertEquals(AnthropicMessagesAdapter.API_VERSION, request.getHeaders().get("anthropic-version"));
        assertEquals("sk-ant-test-000000000", request.getHeaders().get("x-api-key"));
        JsonNode payload = request.getPayload();
        assertEquals("system text", payload.path("system").asText());
        assertEquals(AnthropicMessagesAdapter.DEFAULT_MAX_TOKENS, payload.path("max_tokens").asInt());
    }

    @Test
    void maxTokensStopIsContinuedStatelessly() {
        transport.respond(200, message("part ", "max_tokens", 50, 100));
        transport.respond(200, message("rest", "end_turn", 60, 10));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.builder().maxOutputTokens(100).build()), sink);

        assertEquals(2, transport.getRequests().size());
        JsonNode messages = transport.getRequests().get(1).getPayload().path("messages");
        assertEquals(3, messages.size());
        assertEquals("part ", messages.get(1).path("content").asText());
        assertEquals(100, transport.getRequests().get(1).getPayload().path("max_tokens").asInt());
        assertEquals("part rest", sink.last().getText());
        assertEquals(1, sink.last().getContinuationCount());
    }

    @Test
    void rateLimitErrorEvent() {
        transport.respond(200, sse("error", "{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\",\"message\":\"busy\"}}"));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        assertEquals(ErrorKind.RATE_LIMITED, sink.last().getErrorKind());
    }

    @Test
    void overloadedStatusIsTransport() {
        transport.respond(529, "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\"}}");
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        assertEquals(ErrorKind.TRANSPORT, sink.last().getErrorKind());
    }
}
