package com.arcdispatch.providers;

import java.io.IOException;

/**
 * Sends one streaming POST to a provider endpoint. The HTTP implementation is used in
 * production; tests script responses.
 */
public interface ProviderTransport {

    /**
     * Open the call. Non-2xx statuses are returned, not thrown; the caller classifies them.
     */
    TransportResponse post(TransportRequest request) throws IOException, InterruptedException;
}
