package com.arcdispatch.session;

import com.arcdispatch.models.StreamEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only event buffer for one session. One writer stamps sequence numbers; any number of
 * readers wait on it with timeouts. Appending a terminal event closes the log.
 */
public class SessionEventLog {

    private final List<StreamEvent> events = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean closed;

    /**
     * @return the stamped event, or null when the log is already closed
     */
    public StreamEvent append(StreamEvent event) {
        lock.lock();
        try {
            if (closed) {
                return null;
            }
            StreamEvent stamped = event.withSequence(events.size());
            events.add(stamped);
            if (stamped.isTerminal()) {
                closed = true;
            }
            changed.signalAll();
            return stamped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Events from {@code fromIndex} on, waiting up to {@code timeout} for at least one.
     * Returns an empty list on timeout or when the log is closed and fully read.
     */
    public List<StreamEvent> awaitFrom(int fromIndex, long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (events.size() <= fromIndex && !closed) {
                if (remaining <= 0L) {
                    return List.of();
                }
                remaining = changed.awaitNanos(remaining);
            }
            if (events.size() <= fromIndex) {
                return List.of();
            }
            return new ArrayList<>(events.subList(fromIndex, events.size()));
        } finally {
            lock.unlock();
        }
    }

    public List<StreamEvent> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(events);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
