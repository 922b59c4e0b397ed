package com.arcdispatch.providers;

import com.arcdispatch.models.ErrorKind;

import java.io.IOException;

/**
 * Provider call failure classified into an {@link ErrorKind}. Messages are sanitized before
 * they reach an error event.
 */
public class ProviderException extends IOException {

    private final ErrorKind kind;
    private final int statusCode;

    public ProviderException(ErrorKind kind, String message) {
        this(kind, message, -1, null);
    }

    public ProviderException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public ProviderException(ErrorKind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    /**
     * Classify a non-2xx HTTP response.
     */
    public static ProviderException fromStatus(int statusCode, String body, boolean continuationRequest) {
        String detail = body == null ? "" : body.trim();
        if (detail.length() > 500) {
            detail = detail.substring(0, 500) + "...";
        }
        String message = "Provider request failed (" + statusCode + ")" + (detail.isEmpty() ? "" : ": " + detail);
        if (statusCode == 429) {
            return new ProviderException(ErrorKind.RATE_LIMITED, message, statusCode, null);
        }
        if (continuationRequest && (statusCode == 400 || statusCode == 404) && mentionsContinuation(detail)) {
            return new ProviderException(ErrorKind.CONTINUATION_REJECTED, message, statusCode, null);
        }
        return new ProviderException(ErrorKind.TRANSPORT, message, statusCode, null);
    }

    static boolean mentionsContinuation(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase();
        return lower.contains("previous_response") || lower.contains("previous response")
            || lower.contains("response_not_found") || lower.contains("response with id");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
