package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure taxonomy shared by adapters, the session manager and the validator.
 */
public enum ErrorKind {
    /** Network failure or timeout. Retryable by the caller. */
    TRANSPORT("Transport"),
    /** Provider backpressure. Never retried automatically. */
    RATE_LIMITED("RateLimited"),
    /** Unparseable or non-compliant provider payload. */
    SCHEMA_VIOLATION("SchemaViolation"),
    /** Provider refused a continuation handle (expired or unknown). */
    CONTINUATION_REJECTED("ContinuationRejected"),
    /** Auto-continuation budget exhausted while the provider kept truncating. */
    TRUNCATED_OUTPUT("TruncatedOutput"),
    /** Predicted grid count differs from the puzzle's test count. */
    PREDICTION_COUNT_MISMATCH("PredictionCountMismatch"),
    /** Storage collaborator failed; the analysis itself stands. */
    PERSISTENCE_FAILURE("PersistenceFailure");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isRetryableByCaller() {
        return this == TRANSPORT || this == RATE_LIMITED;
    }
}
