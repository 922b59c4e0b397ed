package com.arcdispatch.session;

import com.arcdispatch.models.AnalysisRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded record of past requests and their final answers. Outlives session retention so an
 * expired session can still be retried with its full context. Oldest entries drop first.
 */
public class RequestIndex {

    public static final int DEFAULT_CAPACITY = 1000;

    private final Map<String, Entry> entries;

    public RequestIndex() {
        this(DEFAULT_CAPACITY);
    }

    public RequestIndex(int capacity) {
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized void record(String sessionId, AnalysisRequest request) {
        entries.put(sessionId, new Entry(request));
    }

    public synchronized void recordAnswer(String sessionId, String answer) {
        Entry entry = entries.get(sessionId);
        if (entry != null && answer != null && !answer.isBlank()) {
            entry.answer = answer;
        }
    }

    public synchronized Entry find(String sessionId) {
        return entries.get(sessionId);
    }

    public synchronized int size() {
        return entries.size();
    }

    public static final class Entry {
        private final AnalysisRequest request;
        private volatile String answer;

        Entry(AnalysisRequest request) {
            this.request = request;
        }

        public AnalysisRequest getRequest() {
            return request;
        }

        /** Final answer text, or null if the session never produced one. */
        public String getAnswer() {
            return answer;
        }
    }
}
