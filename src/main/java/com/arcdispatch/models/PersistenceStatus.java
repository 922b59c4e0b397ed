package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of handing a completed result to the storage collaborator. Reported next to the
 * result and never folded into the session state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PersistenceStatus {

    public enum State {
        NOT_APPLICABLE, PENDING, SAVED, FAILED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static final PersistenceStatus NOT_APPLICABLE = new PersistenceStatus(State.NOT_APPLICABLE, null, null);
    public static final PersistenceStatus PENDING = new PersistenceStatus(State.PENDING, null, null);

    private final State state;
    private final String recordId;
    private final String warning;

    private PersistenceStatus(State state, String recordId, String warning) {
        this.state = state;
        this.recordId = recordId;
        this.warning = warning;
    }

    public static PersistenceStatus saved(String recordId) {
        return new PersistenceStatus(State.SAVED, recordId, null);
    }

    public static PersistenceStatus failed(String warning) {
        return new PersistenceStatus(State.FAILED, null, warning);
    }

    public State getState() {
        return state;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getWarning() {
        return warning;
    }

    /** Always {@link ErrorKind#PERSISTENCE_FAILURE} when failed, otherwise null. */
    public ErrorKind getWarningKind() {
        return state == State.FAILED ? ErrorKind.PERSISTENCE_FAILURE : null;
    }
}
