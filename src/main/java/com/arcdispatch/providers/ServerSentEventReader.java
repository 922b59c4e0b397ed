package com.arcdispatch.providers;

import java.io.InterruptedIOException;
import java.util.Iterator;

/**
 * Pulls server-sent events out of a line iterator. Comment lines are skipped, multi-line data
 * fields are joined with newlines, and a {@code [DONE]} payload ends the stream.
 */
public class ServerSentEventReader {

    private static final String DONE = "[DONE]";

    private final Iterator<String> lines;
    private boolean finished;

    public ServerSentEventReader(Iterator<String> lines) {
        this.lines = lines;
    }

    /**
     * Next complete event, or null at end of stream.
     */
    public ServerSentEvent next() throws InterruptedIOException {
        if (finished) {
            return null;
        }
        String eventName = null;
        StringBuilder data = null;
        while (lines.hasNext()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Stream read interrupted");
            }
            String line = lines.next();
            if (line == null) {
                continue;
            }
            if (line.isEmpty()) {
                if (data != null) {
                    ServerSentEvent event = toEvent(eventName, data.toString());
                    if (event != null || finished) {
                        return event;
                    }
                }
                eventName = null;
                data = null;
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            if (line.startsWith("event:")) {
                eventName = line.substring(6).trim();
            } else if (line.startsWith("data:")) {
                String value = line.substring(5);
                if (value.startsWith(" ")) {
                    value = value.substring(1);
                }
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
        }
        finished = true;
        if (data != null) {
            return toEvent(eventName, data.toString());
        }
        return null;
    }

    public boolean isDone() {
        return finished;
    }

    private ServerSentEvent toEvent(String eventName, String data) {
        if (DONE.equals(data.trim())) {
            finished = true;
            return null;
        }
        return new ServerSentEvent(eventName, data);
    }

    public static final class ServerSentEvent {
        private final String event;
        private final String data;

        public ServerSentEvent(String event, String data) {
            this.event = event;
            this.data = data;
        }

        /** Value of the {@code event:} field, or null when the server sent none. */
        public String getEvent() {
            return event;
        }

        public String getData() {
            return data;
        }
    }
}
