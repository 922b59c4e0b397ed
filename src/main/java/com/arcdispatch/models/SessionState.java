package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionState {
    CREATED,
    STREAMING,
    COMPLETED,
    ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == CANCELLED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
