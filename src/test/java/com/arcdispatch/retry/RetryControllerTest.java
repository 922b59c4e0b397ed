package com.arcdispatch.retry;

import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.AnalysisRequest;
import com.arcdispatch.models.AnalysisResult;
import com.arcdispatch.models.ConversationTurn;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.SessionState;
import com.arcdispatch.models.StreamEvent;
import com.arcdispatch.providers.ProviderCall;
import com.arcdispatch.session.FakeAdapter;
import com.arcdispatch.session.SessionNotFoundException;
import com.arcdispatch.session.SessionNotReadyException;
import com.arcdispatch.session.SessionTestHarness;
import com.arcdispatch.session.StreamSessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.arcdispatch.session.SessionTestHarness.PUZZLE_ID;
import static org.junit.jupiter.api.Assertions.*;

class RetryControllerTest {

    private static final String FIRST_ANSWER = "My first guess: {\"predictedOutput\": [[0]]}";

    private final SessionTestHarness harness = new SessionTestHarness();
    private final StreamSessionManager manager = harness.manager;
    private final RetryController retries = new RetryController(manager);

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private String runFirst(String providerId, String handle) throws InterruptedException {
        harness.adapter(providerId).then(FakeAdapter.answer(FIRST_ANSWER, handle));
        String sessionId = manager.open(AnalysisRequest.of(PUZZLE_ID, "model-x", providerId, AnalysisConfig.defaults()));
        harness.finish(sessionId);
        return sessionId;
    }

    private ProviderCall lastCall(String providerId) {
        List<ProviderCall> calls = harness.adapter(providerId).getCalls();
        return calls.get(calls.size() - 1);
    }

    @Test
    void statefulProviderContinuesByHandle() throws Exception {
        String prior = runFirst("openai", "resp_1");
        AnalysisResult before = manager.getResult(prior);

        String retry = retries.retry(prior, "Look at the colours again.");
        AnalysisResult after = harness.finish(retry);

        ProviderCall call = lastCall("openai");
        assertTrue(call.isContinuation());
        assertEquals("resp_1", call.getPreviousHandle());
        assertEquals(1, call.getTurns().size());
        assertEquals("Look at the colours again.", call.getTurns().get(0).getContent());

        assertNotEquals(prior, retry);
        assertEquals(prior, after.getRetryOf());
        assertEquals(SessionState.COMPLETED, after.getState());
        assertSame(before, manager.getResult(prior));
        assertEquals(FIRST_ANSWER, manager.getResult(prior).getRawText());
    }

    @Test
    void statelessProviderReplaysConversation() throws Exception {
        String prior = runFirst("openrouter", null);

        harness.finish(retries.retry(prior, "Try a different rule."));

        ProviderCall call = lastCall("openrouter");
        assertFalse(call.isContinuation());
        List<ConversationTurn> turns = call.getTurns();
        assertEquals(3, turns.size());
        assertEquals(ConversationTurn.Role.USER, turns.get(0).getRole());
        assertEquals(ConversationTurn.Role.ASSISTANT, turns.get(1).getRole());
        assertEquals(FIRST_ANSWER, turns.get(1).getContent());
        assertEquals("Try a different rule.", turns.get(2).getContent());
    }

    @Test
    void expiredPriorSessionRetriesFresh() throws Exception {
        String prior = runFirst("openai", "resp_1");
        harness.clock.advance(SessionTestHarness.RETENTION.plusMinutes(1));
        assertNull(manager.find(prior));

        AnalysisRequest plan = retries.plan(prior, "Again please.");

        assertFalse(plan.hasContinuationHandle());
        assertEquals(prior, plan.getRetryOf());
        assertEquals(FIRST_ANSWER, plan.getPriorTurns().get(plan.getPriorTurns().size() - 1).getContent());

        harness.finish(retries.retry(prior, "Again please."));
        assertFalse(lastCall("openai").isContinuation());
    }

    @Test
    void retryOfContinuedRetryKeepsWholeConversation() throws Exception {
        String first = runFirst("openai", "resp_1");
        harness.adapter("openai").then(FakeAdapter.answer("Second try: {\"predictedOutput\": [[2]]}", "resp_2"));
        String second = retries.retry(first, "Check the corners.");
        harness.finish(second);
        harness.clock.advance(SessionTestHarness.RETENTION.plusMinutes(1));
        assertNull(manager.find(second));

        AnalysisRequest plan = retries.plan(second, "Third attempt.");

        List<ConversationTurn> turns = plan.getPriorTurns();
        assertFalse(plan.hasContinuationHandle());
        assertEquals(3, turns.size());
        assertEquals(FIRST_ANSWER, turns.get(0).getContent());
        assertEquals("Check the corners.", turns.get(1).getContent());
        assertEquals("Second try: {\"predictedOutput\": [[2]]}", turns.get(2).getContent());
        assertEquals("Third attempt.", plan.getFollowUpInstruction());

        harness.finish(retries.retry(second, "Third attempt."));
        List<ConversationTurn> sent = lastCall("openai").getTurns();
        assertEquals(List.of(ConversationTurn.Role.USER, ConversationTurn.Role.ASSISTANT, ConversationTurn.Role.USER,
            ConversationTurn.Role.ASSISTANT, ConversationTurn.Role.USER),
            sent.stream().map(ConversationTurn::getRole).collect(Collectors.toList()));
    }

    @Test
    void rejectedHandleFallsBackToFreshOnce() throws Exception {
        String prior = runFirst("openai", "resp_1");
        harness.adapter("openai")
            .then(FakeAdapter.fail(ErrorKind.CONTINUATION_REJECTED, "Previous response with id 'resp_1' not found."))
            .then(FakeAdapter.answer(FakeAdapter.CORRECT_ANSWER, "resp_2"));

        String retry = retries.retry(prior, "Once more.");
        List<StreamEvent> events = harness.drain(retry);

        List<ProviderCall> calls = harness.adapter("openai").getCalls();
        assertEquals(3, calls.size());
        assertTrue(calls.get(1).isContinuation());
        assertFalse(calls.get(2).isContinuation());
        assertEquals(1, events.stream().filter(e -> e.getType() == StreamEvent.Type.STARTED).count());
        assertEquals(0, events.stream().filter(e -> e.getType() == StreamEvent.Type.ERROR).count());

        AnalysisResult result = manager.getResult(retry);
        assertEquals(SessionState.COMPLETED, result.getState());
        assertTrue(result.getValidation().isAllCorrect());
        assertEquals("resp_2", result.getContinuationHandle());
    }

    @Test
    void fallbackFailureIsReported() throws Exception {
        String prior = runFirst("openai", "resp_1");
        harness.adapter("openai")
            .then(FakeAdapter.fail(ErrorKind.CONTINUATION_REJECTED, "gone"))
            .then(FakeAdapter.fail(ErrorKind.RATE_LIMITED, "slow down"));

        AnalysisResult result = harness.finish(retries.retry(prior, null));

        assertEquals(SessionState.ERROR, result.getState());
        assertEquals(ErrorKind.RATE_LIMITED, result.getErrorKind());
        assertEquals(3, harness.adapter("openai").getCalls().size());
    }

    @Test
    void retryOfRunningSessionIsNotReady() throws Exception {
        harness.adapter("anthropic").then(FakeAdapter.hang());
        String running = manager.open(AnalysisRequest.of(PUZZLE_ID, "model-x", "anthropic", AnalysisConfig.defaults()));
        harness.awaitState(running, SessionState.STREAMING);

        assertThrows(SessionNotReadyException.class, () -> retries.retry(running, "x"));
        manager.cancel(running);
    }

    @Test
    void retryOfUnknownSessionIsNotFound() {
        assertThrows(SessionNotFoundException.class, () -> retries.retry("sess_unknown", "x"));
    }
}
