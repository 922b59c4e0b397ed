package com.arcdispatch.providers;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Status plus the body as a lazily read line stream. Closing the response closes the body.
 */
public final class TransportResponse implements AutoCloseable {

    private final int statusCode;
    private final Stream<String> lines;

    public TransportResponse(int statusCode, Stream<String> lines) {
        this.statusCode = statusCode;
        this.lines = lines != null ? lines : Stream.empty();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Stream<String> getLines() {
        return lines;
    }

    /**
     * Drain the whole body. Only meant for error responses.
     */
    public String readBody() {
        return lines.collect(Collectors.joining("\n"));
    }

    @Override
    public void close() {
        lines.close();
    }
}
