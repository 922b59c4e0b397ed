package com.arcdispatch.session;

import com.arcdispatch.coordinator.SlotTicket;
import com.arcdispatch.models.AnalysisRequest;
import com.arcdispatch.models.AnalysisResult;
import com.arcdispatch.models.AnswerDetails;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.PersistenceStatus;
import com.arcdispatch.models.PredictionValidation;
import com.arcdispatch.models.SessionState;
import com.arcdispatch.models.StreamEvent;
import com.arcdispatch.models.TokenUsage;

import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * One analysis attempt. Mutated only through the synchronized transition methods, which
 * drop events from superseded attempts and everything after a terminal state.
 */
public class ProviderSession {

    private final String sessionId;
    private final AnalysisRequest request;
    private final boolean statefulProvider;
    private final long createdAt;
    private final SessionEventLog events = new SessionEventLog();

    private SessionState state = SessionState.CREATED;
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private TokenUsage usage = TokenUsage.ZERO;
    private String continuationHandle;
    private int continuationCount;
    private long terminalAt;
    private ErrorKind errorKind;
    private String errorMessage;
    private AnalysisResult result;
    private int attempt;
    private boolean sawOutput;
    private StreamEvent deferredError;
    private SlotTicket ticket;
    private Future<?> worker;
    private ScheduledFuture<?> timeout;
    private long firstCallAt;
    private volatile PersistenceStatus persistence = PersistenceStatus.NOT_APPLICABLE;

    ProviderSession(String sessionId, AnalysisRequest request, boolean statefulProvider, long createdAt) {
        this.sessionId = sessionId;
        this.request = request;
        this.statefulProvider = statefulProvider;
        this.createdAt = createdAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public AnalysisRequest getRequest() {
        return request;
    }

    /**
     * Whether the provider this session ran on keeps conversation state.
     */
    public boolean isStatefulProvider() {
        return statefulProvider;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    SessionEventLog getEvents() {
        return events;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized String getText() {
        return text.toString();
    }

    public synchronized String getReasoning() {
        return reasoning.toString();
    }

    public synchronized String getContinuationHandle() {
        return continuationHandle;
    }

    public synchronized long getTerminalAt() {
        return terminalAt;
    }

    public synchronized AnalysisResult getResult() {
        return result;
    }

    public PersistenceStatus getPersistence() {
        return persistence;
    }

    void setPersistence(PersistenceStatus persistence) {
        this.persistence = persistence;
    }

    synchronized int currentAttempt() {
        return attempt;
    }

    synchronized void setWorker(Future<?> worker) {
        this.worker = worker;
        if (state.isTerminal()) {
            worker.cancel(true);
        }
    }

    /**
     * Timer that fails the session when the call runs too long. Cancelled on any terminal transition.
     */
    synchronized void setTimeout(ScheduledFuture<?> timeout) {
        this.timeout = timeout;
        if (state.isTerminal()) {
            timeout.cancel(false);
        }
    }

    synchronized void interruptWorker() {
        if (worker != null) {
            worker.cancel(true);
        }
    }

    /**
     * Hold the slot for this session. Returns false, and frees the slot at once, if the session
     * ended while it was queued.
     */
    synchronized boolean attachTicket(SlotTicket slotTicket, long now) {
        if (state.isTerminal()) {
            slotTicket.close();
            return false;
        }
        this.ticket = slotTicket;
        this.firstCallAt = now;
        return true;
    }

    synchronized void releaseTicket() {
        if (ticket != null) {
            ticket.close();
        }
    }

    synchronized boolean onStarted(int fromAttempt) {
        if (!accepts(fromAttempt) || state != SessionState.CREATED) {
            return false;
        }
        state = SessionState.STREAMING;
        events.append(StreamEvent.started());
        return true;
    }

    synchronized boolean onTextDelta(int fromAttempt, StreamEvent delta) {
        if (!accepts(fromAttempt)) {
            return false;
        }
        ensureStreaming();
        sawOutput = true;
        text.append(delta.getText());
        events.append(delta);
        return true;
    }

    synchronized boolean onReasoningDelta(int fromAttempt, StreamEvent delta) {
        if (!accepts(fromAttempt)) {
            return false;
        }
        ensureStreaming();
        sawOutput = true;
        reasoning.append(delta.getText());
        events.append(delta);
        return true;
    }

    /**
     * Publish the adapter's completion with its validation.
     *
     * @return the finished result, or null if the event was dropped
     */
    synchronized AnalysisResult complete(int fromAttempt, StreamEvent completed, PredictionValidation validation,
                                         AnswerDetails details, long now) {
        if (!accepts(fromAttempt)) {
            return null;
        }
        ensureStreaming();
        absorb(completed);
        state = SessionState.COMPLETED;
        terminalAt = now;
        stopTimeout();
        result = buildResult().validation(validation).answerDetails(details).build();
        persistence = PersistenceStatus.PENDING;
        events.append(completed);
        return result;
    }

    /**
     * End in error. {@code completed} is the adapter's completion when the failure came from
     * validation, so its text, usage and any grids found are kept.
     */
    synchronized boolean fail(int fromAttempt, ErrorKind kind, String message, StreamEvent completed,
                              List<int[][]> foundGrids, long now) {
        return fail(fromAttempt, kind, message, completed, foundGrids, null, now);
    }

    synchronized boolean fail(int fromAttempt, ErrorKind kind, String message, StreamEvent completed,
                              List<int[][]> foundGrids, AnswerDetails details, long now) {
        if (!accepts(fromAttempt)) {
            return false;
        }
        if (completed != null) {
            absorb(completed);
        }
        state = SessionState.ERROR;
        terminalAt = now;
        stopTimeout();
        errorKind = kind;
        errorMessage = message;
        result = buildResult().predictedGrids(foundGrids).answerDetails(details).build();
        events.append(StreamEvent.error(kind, message));
        return true;
    }

    /**
     * Caller cancel. Frees the slot and interrupts the worker; later adapter events are dropped.
     */
    synchronized boolean cancel(long now) {
        if (state.isTerminal()) {
            return false;
        }
        state = SessionState.CANCELLED;
        terminalAt = now;
        stopTimeout();
        result = buildResult().build();
        events.append(StreamEvent.cancelled());
        releaseTicket();
        interruptWorker();
        return true;
    }

    /**
     * Hold back an error from the first attempt so the fresh fallback can run instead.
     */
    synchronized boolean deferForFallback(int fromAttempt, StreamEvent error) {
        if (!accepts(fromAttempt) || fromAttempt != 0 || sawOutput || deferredError != null) {
            return false;
        }
        deferredError = error;
        return true;
    }

    synchronized boolean hasDeferredError() {
        return deferredError != null;
    }

    /**
     * Switch to the fallback attempt. Returns the new attempt number, or -1 if the session ended.
     */
    synchronized int beginFallback() {
        if (state.isTerminal()) {
            return -1;
        }
        deferredError = null;
        attempt++;
        return attempt;
    }

    private AnalysisResult.Builder buildResult() {
        AnalysisResult.Builder builder = AnalysisResult.builder()
            .sessionId(sessionId)
            .request(request)
            .state(state)
            .rawText(text.toString())
            .reasoningText(reasoning.length() > 0 ? reasoning.toString() : null)
            .usage(usage)
            .continuationHandle(continuationHandle)
            .continuationCount(continuationCount)
            .error(errorKind, errorMessage)
            .createdAt(createdAt)
            .completedAt(terminalAt > 0 ? terminalAt : null);
        if (firstCallAt > 0 && terminalAt > 0) {
            builder.apiProcessingTimeMs(terminalAt - firstCallAt);
        }
        return builder;
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, request, state, text.length(), reasoning.length(), events.size(),
            usage, continuationHandle != null, createdAt, terminalAt, errorKind, errorMessage, persistence);
    }

    private void absorb(StreamEvent completed) {
        if (completed.getText() != null && completed.getText().length() >= text.length()) {
            text.setLength(0);
            text.append(completed.getText());
        }
        if (completed.getUsage() != null) {
            usage = completed.getUsage();
        }
        if (completed.getContinuationHandle() != null) {
            continuationHandle = completed.getContinuationHandle();
        }
        if (completed.getContinuationCount() != null) {
            continuationCount = completed.getContinuationCount();
        }
    }

    private void stopTimeout() {
        if (timeout != null) {
            timeout.cancel(false);
            timeout = null;
        }
    }

    private boolean accepts(int fromAttempt) {
        return !state.isTerminal() && fromAttempt == attempt;
    }

    private void ensureStreaming() {
        if (state == SessionState.CREATED) {
            state = SessionState.STREAMING;
            events.append(StreamEvent.started());
        }
    }
}
