package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized provider event. Adapters create events without a sequence number; the session
 * log stamps one when the event is appended.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StreamEvent {

    public enum Type {
        STARTED("started"),
        TEXT_DELTA("text_delta"),
        REASONING_DELTA("reasoning_delta"),
        COMPLETED("completed"),
        ERROR("error"),
        CANCELLED("cancelled");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == ERROR || this == CANCELLED;
        }
    }

    private final long sequence;
    private final Type type;
    private final String text;
    private final TokenUsage usage;
    private final String continuationHandle;
    private final Integer continuationCount;
    private final ErrorKind errorKind;
    private final String message;

    private StreamEvent(long sequence, Type type, String text, TokenUsage usage, String continuationHandle,
                        Integer continuationCount, ErrorKind errorKind, String message) {
        this.sequence = sequence;
        this.type = type;
        this.text = text;
        this.usage = usage;
        this.continuationHandle = continuationHandle;
        this.continuationCount = continuationCount;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static StreamEvent started() {
        return new StreamEvent(-1, Type.STARTED, null, null, null, null, null, null);
    }

    public static StreamEvent textDelta(String text) {
        return new StreamEvent(-1, Type.TEXT_DELTA, text, null, null, null, null, null);
    }

    public static StreamEvent reasoningDelta(String text) {
        return new StreamEvent(-1, Type.REASONING_DELTA, text, null, null, null, null, null);
    }

    /**
     * Terminal success. {@code finalText} is the full accumulated answer text.
     */
    public static StreamEvent completed(String finalText, TokenUsage usage, String continuationHandle,
                                        int continuationCount) {
        return new StreamEvent(-1, Type.COMPLETED, finalText,
            usage != null ? usage : TokenUsage.ZERO, continuationHandle, continuationCount, null, null);
    }

    public static StreamEvent error(ErrorKind kind, String message) {
        return new StreamEvent(-1, Type.ERROR, null, null, null, null, kind, message);
    }

    public static StreamEvent cancelled() {
        return new StreamEvent(-1, Type.CANCELLED, null, null, null, null, null, null);
    }

    public StreamEvent withSequence(long sequence) {
        return new StreamEvent(sequence, type, text, usage, continuationHandle, continuationCount, errorKind, message);
    }

    public long getSequence() {
        return sequence;
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public String getContinuationHandle() {
        return continuationHandle;
    }

    public Integer getContinuationCount() {
        return continuationCount;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type.isTerminal();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.getWireName());
        sb.append('#').append(sequence);
        if (errorKind != null) {
            sb.append(' ').append(errorKind.getWireName());
        }
        return sb.toString();
    }
}
