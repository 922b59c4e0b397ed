package com.arcdispatch.providers;

import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.ConversationTurn;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.ReasoningLevel;
import com.arcdispatch.models.StreamEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.arcdispatch.providers.ScriptedTransport.concat;
import static com.arcdispatch.providers.ScriptedTransport.sse;
import static org.junit.jupiter.api.Assertions.*;

class OpenAiResponsesAdapterTest {

    private static final String API_KEY = "sk-test-secret-1234567890";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ScriptedTransport transport = new ScriptedTransport();

    private OpenAiResponsesAdapter adapter() {
        ProviderEndpointConfig endpoint = new ProviderEndpointConfig("openai", "responses", "http://localhost:9/v1");
        endpoint.setApiKeyEnv("OPENAI_API_KEY");
        endpoint.setEnvironment(name -> "OPENAI_API_KEY".equals(name) ? API_KEY : null);
        return new OpenAiResponsesAdapter(mapper, transport, endpoint);
    }

    private static ProviderCall call(AnalysisConfig config) {
        return new ProviderCall("gpt-test", config, "Solve the puzzle.",
            List.of(ConversationTurn.user("puzzle prompt")), null, 1);
    }

    private static List<String> incomplete(String id, String text, int input, int output) {
        return concat(
            sse("response.created", "{\"type\":\"response.created\",\"response\":{\"id\":\"" + id + "\"}}"),
            sse("response.output_text.delta", "{\"type\":\"response.output_text.delta\",\"delta\":\"" + text + "\"}"),
            sse("response.incomplete", "{\"type\":\"response.incomplete\",\"response\":{\"id\":\"" + id
                + "\",\"status\":\"incomplete\",\"incomplete_details\":{\"reason\":\"max_output_tokens\"},"
                + "\"usage\":{\"input_tokens\":" + input + ",\"output_tokens\":" + output + "}}}"));
    }

    private static List<String> completed(String id, String text, int input, int output, int reasoning) {
        return concat(
            sse("response.created", "{\"type\":\"response.created\",\"response\":{\"id\":\"" + id + "\"}}"),
            sse("response.reasoning_summary_text.delta", "{\"type\":\"response.reasoning_summary_text.delta\",\"delta\":\"thinking\"}"),
            sse("response.output_text.delta", "{\"type\":\"response.output_text.delta\",\"delta\":\"" + text + "\"}"),
            sse("response.completed", "{\"type\":\"response.completed\",\"response\":{\"id\":\"" + id
                + "\",\"status\":\"completed\",\"usage\":{\"input_tokens\":" + input + ",\"output_tokens\":" + output
                + ",\"output_tokens_details\":{\"reasoning_tokens\":" + reasoning + "}}}}"));
    }

    @Test
    void streamsSingleCompleteResponse() {
        transport.respond(200, completed("resp_1", "answer", 100, 40, 10));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        assertEquals(List.of(StreamEvent.Type.STARTED, StreamEvent.Type.REASONING_DELTA,
            StreamEvent.Type.TEXT_DELTA, StreamEvent.Type.COMPLETED), sink.types());
        StreamEvent done = sink.last();
        assertEquals("answer", done.getText());
        assertEquals("resp_1", done.getContinuationHandle());
        assertEquals(0, done.getContinuationCount());
        assertEquals(100, done.getUsage().getInputTokens());
        assertEquals(40, done.getUsage().getOutputTokens());
        assertEquals(10, done.getUsage().getReasoningTokens());
        assertEquals(140, done.getUsage().getTotalTokens());
    }

    @Test
    void continuesTruncatedOutputByResponseId() {
        transport.respond(200, incomplete("resp_1", "Part one ", 100, 50));
        transport.respond(200, incomplete("resp_2", "part two ", 10, 50));
        transport.respond(200, completed("resp_3", "done", 10, 20, 5));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        List<TransportRequest> requests = transport.getRequests();
        assertEquals(3, requests.size());
        assertFalse(requests.get(0).getPayload().has("previous_response_id"));
        assertEquals("resp_1", requests.get(1).getPayload().path("previous_response_id").asText());
        assertEquals("resp_2", requests.get(2).getPayload().path("previous_response_id").asText());
        JsonNode continuationInput = requests.get(1).getPayload().path("input");
        assertEquals(1, continuationInput.size());
        assertEquals(AbstractProviderAdapter.CONTINUE_PROMPT, continuationInput.get(0).path("content").asText());

        StreamEvent done = sink.last();
        assertEquals(StreamEvent.Type.COMPLETED, done.getType());
        assertEquals("Part one part two done", done.getText());
        assertEquals(2, done.getContinuationCount());
        assertEquals("resp_3", done.getContinuationHandle());
        assertEquals(120, done.getUsage().getInputTokens());
        assertEquals(120, done.getUsage().getOutputTokens());
        assertEquals(1, sink.types().stream().filter(t -> t == StreamEvent.Type.STARTED).count());
    }

    @Test
    void exhaustedContinuationBudgetIsTruncatedOutput() {
        transport.respond(200, incomplete("resp_1", "a", 1, 1));
        transport.respond(200, incomplete("resp_2", "b", 1, 1));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.builder().maxContinuations(1).build()), sink);

        assertEquals(2, transport.getRequests().size());
        StreamEvent last = sink.last();
        assertEquals(StreamEvent.Type.ERROR, last.getType());
        assertEquals(ErrorKind.TRUNCATED_OUTPUT, last.getErrorKind());
    }

    @Test
    void zeroBudgetNeverContinues() {
        transport.respond(200, incomplete("resp_1", "a", 1, 1));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.builder().maxContinuations(0).build()), sink);

        assertEquals(1, transport.getRequests().size());
        assertEquals(ErrorKind.TRUNCATED_OUTPUT, sink.last().getErrorKind());
    }

    @Test
    void status429IsRateLimited() {
        transport.respond(429, "{\"error\":{\"message\":\"Rate limit reached\"}}");
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        assertEquals(ErrorKind.RATE_LIMITED, sink.last().getErrorKind());
    }

    @Test
    void rejectedPreviousResponseIsContinuationRejected() {
        transport.respond(400, "{\"error\":{\"message\":\"Previous response with id 'resp_old' not found.\","
            + "\"code\":\"previous_response_not_found\"}}");
        RecordingSink sink = new RecordingSink();
        ProviderCall continuation = call(AnalysisConfig.defaults()).continueFrom("resp_old", "Try again");

        adapter().stream(continuation, sink);

        assertEquals(ErrorKind.CONTINUATION_REJECTED, sink.last().getErrorKind());
    }

    @Test
    void sameErrorOnFreshCallIsTransport() {
        transport.respond(400, "{\"error\":{\"message\":\"Previous response with id 'resp_old' not found.\"}}");
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        assertEquals(ErrorKind.TRANSPORT, sink.last().getErrorKind());
    }

    @Test
    void errorEventsNeverCarryTheApiKey() {
        transport.respond(401, "{\"error\":{\"message\":\"Incorrect API key provided: " + API_KEY
            + "\"}, \"header\":\"Authorization: Bearer " + API_KEY + "\"}");
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        StreamEvent last = sink.last();
        assertEquals(ErrorKind.TRANSPORT, last.getErrorKind());
        assertFalse(last.getMessage().contains(API_KEY));
        assertTrue(last.getMessage().contains("401"));
    }

    @Test
    void unparseableStreamPayloadIsSchemaViolation() {
        transport.respond(200, sse("response.output_text.delta", "{not json"));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        assertEquals(ErrorKind.SCHEMA_VIOLATION, sink.last().getErrorKind());
    }

    @Test
    void streamEndingEarlyIsTransport() {
        transport.respond(200, sse("response.output_text.delta", "{\"type\":\"response.output_text.delta\",\"delta\":\"x\"}"));
        RecordingSink sink = new RecordingSink();

        adapter().stream(call(AnalysisConfig.defaults()), sink);

        assertEquals(ErrorKind.TRANSPORT, sink.last().getErrorKind());
    }

    @Test
    void payloadCarriesReasoningAndSchemaButNoTemperature() {
        transport.respond(200, completed("resp_1", "x", 1, 1, 0));
        AnalysisConfig config = AnalysisConfig.builder()
            .temperature(0.2)
            .reasoningEffort(ReasoningLevel.HIGH)
            .reasoningVerbosity(ReasoningLevel.LOW)
            .reasoningSummary("detailed")
            .build();

        adapter().stream(call(config), new RecordingSink());

        TransportRequest request = transport.getRequests().get(0);
        assertEquals("http://localhost:9/v1/responses", request.getUrl());
        assertEquals("Bearer " + API_KEY, request.getHeaders().get("Authorization"));
        JsonNode payload = request.getPayload();
        assertEquals("gpt-test", payload.path("model").asText());
        assertTrue(payload.path("stream").asBoolean());
        assertEquals("high", payload.path("reasoning").path("effort").asText());
        assertEquals("detailed", payload.path("reasoning").path("summary").asText());
        assertEquals("low", payload.path("text").path("verbosity").asText());
        assertEquals("json_schema", payload.path("text").path("format").path("type").asText());
        assertFalse(payload.has("temperature"));
    }
}
