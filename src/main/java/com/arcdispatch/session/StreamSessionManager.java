package com.arcdispatch.session;

import com.arcdispatch.AppLogger;
import com.arcdispatch.collaborators.AnalysisResultStore;
import com.arcdispatch.collaborators.PromptBuilder;
import com.arcdispatch.collaborators.PromptBuilder.BuiltPrompt;
import com.arcdispatch.collaborators.PuzzleCatalog;
import com.arcdispatch.coordinator.ProviderSlotCoordinator;
import com.arcdispatch.coordinator.SlotTicket;
import com.arcdispatch.models.AnalysisRequest;
import com.arcdispatch.models.AnalysisResult;
import com.arcdispatch.models.ConversationTurn;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.PersistenceStatus;
import com.arcdispatch.models.Puzzle;
import com.arcdispatch.models.StreamEvent;
import com.arcdispatch.providers.ProviderAdapter;
import com.arcdispatch.providers.ProviderAdapterFactory;
import com.arcdispatch.providers.ProviderCall;
import com.arcdispatch.validation.PredictionValidator;
import com.arcdispatch.validation.ValidationOutcome;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns analysis sessions from {@link #open} to expiry.
 *
 * Each session runs on a worker thread: wait for the provider slot, stream through the adapter,
 * validate the final answer, hand the result to storage. Callers observe it through
 * {@link #subscribe} and {@link #getResult}. Terminal sessions are kept for the retention window,
 * then dropped by the sweeper or on the next lookup.
 */
public class StreamSessionManager {

    public static final Duration DEFAULT_RETENTION = Duration.ofMinutes(5);
    private static final String DEFAULT_FOLLOW_UP = "Your previous answer was not accepted. Please try again.";

    private final ProviderAdapterFactory adapters;
    private final ProviderSlotCoordinator coordinator;
    private final PuzzleCatalog puzzleCatalog;
    private final PromptBuilder promptBuilder;
    private final PredictionValidator validator;
    private final AnalysisResultStore resultStore;
    private final Duration retention;
    private final Clock clock;
    private final AppLogger logger = AppLogger.get();

    private final Map<String, ProviderSession> sessions = new ConcurrentHashMap<>();
    private final RequestIndex requestIndex = new RequestIndex();
    private final ExecutorService workers;
    private final ScheduledThreadPoolExecutor scheduler;
    private final ExecutorService persistenceExecutor;
    private volatile ScheduledFuture<?> sweeper;

    public StreamSessionManager(ProviderAdapterFactory adapters, ProviderSlotCoordinator coordinator,
                                PuzzleCatalog puzzleCatalog, PromptBuilder promptBuilder,
                                PredictionValidator validator, AnalysisResultStore resultStore) {
        this(adapters, coordinator, puzzleCatalog, promptBuilder, validator, resultStore,
            DEFAULT_RETENTION, Clock.systemUTC());
    }

    public StreamSessionManager(ProviderAdapterFactory adapters, ProviderSlotCoordinator coordinator,
                                PuzzleCatalog puzzleCatalog, PromptBuilder promptBuilder,
                                PredictionValidator validator, AnalysisResultStore resultStore,
                                Duration retention, Clock clock) {
        this.adapters = adapters;
        this.coordinator = coordinator;
        this.puzzleCatalog = puzzleCatalog;
        this.promptBuilder = promptBuilder;
        this.validator = validator;
        this.resultStore = resultStore;
        this.retention = retention != null && !retention.isNegative() ? retention : DEFAULT_RETENTION;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.workers = Executors.newCachedThreadPool(threadFactory("session-worker-", new AtomicInteger()));
        this.scheduler = new ScheduledThreadPoolExecutor(1, threadFactory("session-sweeper", null));
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.persistenceExecutor = Executors.newSingleThreadExecutor(threadFactory("result-writer", null));
    }

    /**
     * Schedule the periodic expiry sweep.
     */
    public void start() {
        long intervalMs = Math.max(1000L, Math.min(30_000L, retention.toMillis()));
        sweeper = scheduler.scheduleAtFixedRate(this::sweepExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log("Session retention " + retention.toMinutes() + " minute(s), sweeping every " + (intervalMs / 1000) + "s");
    }

    public void shutdown() {
        scheduler.shutdownNow();
        workers.shutdownNow();
        persistenceExecutor.shutdown();
    }

    /**
     * Create a session and start it in the background.
     *
     * @return the new session id
     * @throws IllegalArgumentException for unknown providers, puzzles or prompt templates
     */
    public String open(AnalysisRequest request) {
        ProviderAdapter adapter = adapters.getAdapter(request.getProviderId());
        Puzzle puzzle = puzzleCatalog.findById(request.getPuzzleId());
        if (puzzle == null) {
            throw new IllegalArgumentException("Unknown puzzle: " + request.getPuzzleId());
        }
        if (puzzle.getTestCount() == 0) {
            throw new IllegalArgumentException("Puzzle " + puzzle.getId() + " has no test cases");
        }
        ProviderCall call = buildCall(request, puzzle, adapter);

        String sessionId = generateSessionId();
        ProviderSession session = new ProviderSession(sessionId, request, adapter.supportsContinuation(), clock.millis());
        sessions.put(sessionId, session);
        requestIndex.record(sessionId, request);
        Future<?> worker = workers.submit(() -> run(session, adapter, puzzle, call));
        session.setWorker(worker);
        logger.debug("[StreamSessionManager] Opened " + sessionId + " for " + request.getProviderId() + "/"
            + request.getModelId() + " puzzle=" + puzzle.getId());

        log("Opened " + sessionId + " puzzle=" + request.getPuzzleId() + " model=" + request.getModelId()
            + " provider=" + request.getProviderId()
            + (request.getRetryOf() != null ? " retryOf=" + request.getRetryOf() : "")
            + (call.isContinuation() ? " (continuation)" : ""));
        return sessionId;
    }

    public EventSubscription subscribe(String sessionId) {
        ProviderSession session = require(sessionId);
        return new EventSubscription(sessionId, session.getEvents());
    }

    /**
     * @return true if the session was active and is now cancelled; false if it had already ended
     */
    public boolean cancel(String sessionId) {
        ProviderSession session = require(sessionId);
        boolean cancelled = session.cancel(clock.millis());
        if (cancelled) {
            log("Cancelled " + sessionId);
        }
        return cancelled;
    }

    /**
     * @throws SessionNotFoundException if unknown or expired
     * @throws SessionNotReadyException if the session has not ended yet
     */
    public AnalysisResult getResult(String sessionId) {
        ProviderSession session = require(sessionId);
        AnalysisResult result = session.getResult();
        if (result == null) {
            throw new SessionNotReadyException(sessionId, session.getState());
        }
        return result;
    }

    public PersistenceStatus getPersistenceStatus(String sessionId) {
        return require(sessionId).getPersistence();
    }

    /**
     * Retained session, or null when unknown or expired.
     */
    public ProviderSession find(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        ProviderSession session = sessions.get(sessionId);
        if (session != null && isExpired(session, clock.millis())) {
            sessions.remove(sessionId, session);
            log("Expired " + sessionId + " on lookup");
            return null;
        }
        return session;
    }

    public ProviderSession require(String sessionId) {
        ProviderSession session = find(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * Original request and final answer of a session, kept after the session itself expired.
     */
    public RequestIndex.Entry findRequest(String sessionId) {
        return requestIndex.find(sessionId);
    }

    public ProviderAdapterFactory getAdapters() {
        return adapters;
    }

    public Duration getRetention() {
        return retention;
    }

    public int getRetainedCount() {
        return sessions.size();
    }

    /**
     * Timeout timers still queued. Each is cancelled when its session ends.
     */
    int getPendingTimeouts() {
        ScheduledFuture<?> sweep = sweeper;
        int queued = scheduler.getQueue().size();
        return sweep != null && !sweep.isDone() ? queued - 1 : queued;
    }

    /**
     * Drop terminal sessions older than the retention window.
     *
     * @return number of sessions removed
     */
    public int sweepExpired() {
        long now = clock.millis();
        int removed = 0;
        for (ProviderSession session : new ArrayList<>(sessions.values())) {
            if (isExpired(session, now) && sessions.remove(session.getSessionId(), session)) {
                removed++;
            }
        }
        if (removed > 0) {
            log("Swept " + removed + " expired session(s)");
        }
        return removed;
    }

    private boolean isExpired(ProviderSession session, long now) {
        return session.isTerminal() && now - session.getTerminalAt() >= retention.toMillis();
    }

    private void run(ProviderSession session, ProviderAdapter adapter, Puzzle puzzle, ProviderCall call) {
        AnalysisRequest request = session.getRequest();
        SlotTicket ticket = null;
        try {
            ticket = coordinator.admit(request.getProviderId());
            if (!session.attachTicket(ticket, clock.millis())) {
                return;
            }
            scheduleTimeout(session, request);
            adapter.stream(call, event -> relay(session, 0, puzzle, event));
            if (session.hasDeferredError()) {
                runFallback(session, adapter, puzzle);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("[StreamSessionManager] Session " + session.getSessionId() + " failed unexpectedly", e);
            session.fail(session.currentAttempt(), ErrorKind.TRANSPORT, "Internal failure: " + describe(e),
                null, null, clock.millis());
        } finally {
            if (ticket != null) {
                ticket.close();
            }
            if (!session.isTerminal()) {
                session.fail(session.currentAttempt(), ErrorKind.TRANSPORT, "Provider stream ended without a result",
                    null, null, clock.millis());
            }
        }
    }

    private void runFallback(ProviderSession session, ProviderAdapter adapter, Puzzle puzzle) {
        AnalysisRequest fallback = session.getRequest().getFreshFallback();
        int attempt = session.beginFallback();
        if (attempt < 0) {
            return;
        }
        logWarning("Continuation for " + session.getSessionId() + " was refused, re-running as a fresh session");
        ProviderCall call = buildCall(fallback, puzzle, adapter);
        adapter.stream(call, event -> relay(session, attempt, puzzle, event));
    }

    private void relay(ProviderSession session, int attempt, Puzzle puzzle, StreamEvent event) {
        switch (event.getType()) {
            case STARTED:
                session.onStarted(attempt);
                break;
            case TEXT_DELTA:
                session.onTextDelta(attempt, event);
                break;
            case REASONING_DELTA:
                session.onReasoningDelta(attempt, event);
                break;
            case COMPLETED:
                onCompleted(session, attempt, puzzle, event);
                break;
            case ERROR:
                onError(session, attempt, event);
                break;
            case CANCELLED:
                session.cancel(clock.millis());
                break;
            default:
                break;
        }
    }

    private void onCompleted(ProviderSession session, int attempt, Puzzle puzzle, StreamEvent completed) {
        ValidationOutcome outcome = validator.validate(completed.getText(), puzzle.getExpectedOutputs());
        long now = clock.millis();
        String sessionId = session.getSessionId();
        if (outcome.isValid()) {
            AnalysisResult result = session.complete(attempt, completed, outcome.getValidation(),
                outcome.getAnswerDetails(), now);
            if (result != null) {
                session.releaseTicket();
                requestIndex.recordAnswer(sessionId, completed.getText());
                log("Completed " + sessionId + " accuracy=" + outcome.getValidation().getAccuracy()
                    + " (" + outcome.getValidation().getExtractionMethod() + ", " + completed.getUsage() + ")");
                persistAsync(session, result);
            }
        } else if (session.fail(attempt, outcome.getErrorKind(), outcome.getErrorDetail(), completed,
            outcome.getFoundGrids(), outcome.getAnswerDetails(), now)) {
            session.releaseTicket();
            requestIndex.recordAnswer(sessionId, completed.getText());
            logWarning(sessionId + " " + outcome.getErrorKind().getWireName() + ": " + outcome.getErrorDetail());
        }
    }

    private void onError(ProviderSession session, int attempt, StreamEvent error) {
        AnalysisRequest fallback = session.getRequest().getFreshFallback();
        if (fallback != null && isFallbackKind(error.getErrorKind()) && session.deferForFallback(attempt, error)) {
            return;
        }
        if (session.fail(attempt, error.getErrorKind(), error.getMessage(), null, null, clock.millis())) {
            session.releaseTicket();
            logWarning(session.getSessionId() + " " + error.getErrorKind().getWireName() + ": " + error.getMessage());
        }
    }

    private static boolean isFallbackKind(ErrorKind kind) {
        return kind == ErrorKind.SCHEMA_VIOLATION || kind == ErrorKind.CONTINUATION_REJECTED;
    }

    private void scheduleTimeout(ProviderSession session, AnalysisRequest request) {
        Long configured = request.getConfig().getTimeoutMs();
        long timeoutMs = configured != null
            ? configured
            : adapters.getSettings().require(request.getProviderId()).getEffectiveTimeoutMs();
        session.setTimeout(scheduler.schedule(() -> onTimeout(session, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS));
    }

    private void onTimeout(ProviderSession session, long timeoutMs) {
        if (session.isTerminal()) {
            return;
        }
        if (session.fail(session.currentAttempt(), ErrorKind.TRANSPORT, "Timed out after " + timeoutMs + " ms",
            null, null, clock.millis())) {
            session.releaseTicket();
            session.interruptWorker();
            logWarning(session.getSessionId() + " timed out after " + timeoutMs + " ms");
        }
    }

    private void persistAsync(ProviderSession session, AnalysisResult result) {
        persistenceExecutor.submit(() -> {
            try {
                String recordId = resultStore.save(result);
                session.setPersistence(PersistenceStatus.saved(recordId));
            } catch (IOException | RuntimeException e) {
                logWarning("Saving " + session.getSessionId() + " failed: " + describe(e));
                session.setPersistence(PersistenceStatus.failed("Result could not be saved: " + describe(e)));
            }
        });
    }

    /**
     * Provider call for a request: a continuation by handle when the request carries one and the
     * provider keeps state, otherwise the full prompt plus any prior turns and follow-up.
     */
    ProviderCall buildCall(AnalysisRequest request, Puzzle puzzle, ProviderAdapter adapter) {
        BuiltPrompt prompt = promptBuilder.build(puzzle, request.getConfig());
        String followUp = request.getFollowUpInstruction();
        if (request.hasContinuationHandle() && adapter.supportsContinuation()) {
            String message = followUp != null && !followUp.isBlank() ? followUp : DEFAULT_FOLLOW_UP;
            return new ProviderCall(request.getModelId(), request.getConfig(), prompt.getSystemPrompt(),
                List.of(ConversationTurn.user(message)), request.getContinuationHandle(), puzzle.getTestCount());
        }
        List<ConversationTurn> turns = new ArrayList<>();
        turns.add(ConversationTurn.user(prompt.getUserPrompt()));
        turns.addAll(request.getPriorTurns());
        if (followUp != null && !followUp.isBlank()) {
            turns.add(ConversationTurn.user(followUp));
        }
        return new ProviderCall(request.getModelId(), request.getConfig(), prompt.getSystemPrompt(),
            mergeConsecutive(turns), null, puzzle.getTestCount());
    }

    /**
     * Join adjacent turns of the same role; chat protocols expect alternating messages.
     */
    static List<ConversationTurn> mergeConsecutive(List<ConversationTurn> turns) {
        List<ConversationTurn> merged = new ArrayList<>();
        for (ConversationTurn turn : turns) {
            if (!merged.isEmpty() && merged.get(merged.size() - 1).getRole() == turn.getRole()) {
                ConversationTurn last = merged.remove(merged.size() - 1);
                merged.add(new ConversationTurn(turn.getRole(), last.getContent() + "\n\n" + turn.getContent()));
            } else {
                merged.add(turn);
            }
        }
        return merged;
    }

    private String generateSessionId() {
        return "sess_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return m == null || m.isBlank() ? e.getClass().getSimpleName() : m;
    }

    private static ThreadFactory threadFactory(String name, AtomicInteger counter) {
        return r -> {
            Thread t = new Thread(r, counter != null ? name + counter.incrementAndGet() : name);
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        logger.info("[StreamSessionManager] " + message);
    }

    private void logWarning(String message) {
        logger.warn("[StreamSessionManager] " + message);
    }
}
