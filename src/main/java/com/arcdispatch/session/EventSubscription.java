package com.arcdispatch.session;

import com.arcdispatch.models.StreamEvent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Cursor over a session's events starting at the first one, so late subscribers see the
 * full history before live events.
 */
public class EventSubscription {

    private final String sessionId;
    private final SessionEventLog log;
    private final Deque<StreamEvent> pending = new ArrayDeque<>();
    private int cursor;
    private boolean finished;

    EventSubscription(String sessionId, SessionEventLog log) {
        this.sessionId = sessionId;
        this.log = log;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Next event, or null if none arrived within the timeout or the stream is finished.
     */
    public StreamEvent next(long timeout, TimeUnit unit) throws InterruptedException {
        if (pending.isEmpty() && !finished) {
            for (StreamEvent event : log.awaitFrom(cursor, timeout, unit)) {
                pending.addLast(event);
                cursor++;
            }
        }
        StreamEvent event = pending.pollFirst();
        if (event != null && event.isTerminal()) {
            finished = true;
        }
        return event;
    }

    /**
     * True once the terminal event has been handed out.
     */
    public boolean isFinished() {
        return finished && pending.isEmpty();
    }
}
