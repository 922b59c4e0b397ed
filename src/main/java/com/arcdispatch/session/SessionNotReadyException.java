package com.arcdispatch.session;

import com.arcdispatch.models.SessionState;

/**
 * The session exists but has not reached a terminal state yet.
 */
public class SessionNotReadyException extends RuntimeException {

    private final String sessionId;
    private final SessionState state;

    public SessionNotReadyException(String sessionId, SessionState state) {
        super("Session " + sessionId + " is still " + state.wireName());
        this.sessionId = sessionId;
        this.state = state;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state;
    }
}
