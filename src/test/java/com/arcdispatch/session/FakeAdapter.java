package com.arcdispatch.session;

import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.StreamEvent;
import com.arcdispatch.models.TokenUsage;
import com.arcdispatch.providers.ProviderAdapter;
import com.arcdispatch.providers.ProviderCall;
import com.arcdispatch.providers.StreamEventSink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter that plays scripted behaviours in order and tracks how many calls run at once.
 */
public class FakeAdapter implements ProviderAdapter {

    public static final String CORRECT_ANSWER = "{\"predictedOutput\": [[1]]}";

    @FunctionalInterface
    public interface Behavior {
        void run(ProviderCall call, StreamEventSink sink) throws InterruptedException;
    }

    private final String name;
    private final boolean stateful;
    private final Deque<Behavior> script = new ArrayDeque<>();
    private final List<ProviderCall> calls = new ArrayList<>();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private Behavior fallback = answer(CORRECT_ANSWER, null);

    public FakeAdapter(String name, boolean stateful) {
        this.name = name;
        this.stateful = stateful;
    }

    public synchronized FakeAdapter then(Behavior behavior) {
        script.addLast(behavior);
        return this;
    }

    public synchronized FakeAdapter otherwise(Behavior behavior) {
        this.fallback = behavior;
        return this;
    }

    @Override
    public String getProviderName() {
        return name;
    }

    @Override
    public boolean supportsContinuation() {
        return stateful;
    }

    @Override
    public void stream(ProviderCall call, StreamEventSink sink) {
        Behavior behavior;
        synchronized (this) {
            calls.add(call);
            behavior = script.isEmpty() ? fallback : script.pollFirst();
        }
        int now = active.incrementAndGet();
        maxActive.accumulateAndGet(now, Math::max);
        try {
            behavior.run(call, sink);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sink.accept(StreamEvent.cancelled());
        } finally {
            active.decrementAndGet();
        }
    }

    public synchronized List<ProviderCall> getCalls() {
        return new ArrayList<>(calls);
    }

    public int getMaxActive() {
        return maxActive.get();
    }

    public static Behavior answer(String text, String handle) {
        return (call, sink) -> {
            sink.accept(StreamEvent.started());
            sink.accept(StreamEvent.textDelta(text));
            sink.accept(StreamEvent.completed(text, new TokenUsage(10, 5, 0), handle, 0));
        };
    }

    public static Behavior fail(ErrorKind kind, String message) {
        return (call, sink) -> {
            sink.accept(StreamEvent.started());
            sink.accept(StreamEvent.error(kind, message));
        };
    }

    /**
     * Streams one delta, then blocks until interrupted.
     */
    public static Behavior hang() {
        return (call, sink) -> {
            sink.accept(StreamEvent.started());
            sink.accept(StreamEvent.textDelta("working"));
            Thread.sleep(Long.MAX_VALUE);
        };
    }
}
