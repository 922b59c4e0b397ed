package com.arcdispatch.providers;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;

/**
 * {@link ProviderTransport} over the JDK HTTP client, reading the body line by line.
 */
public class HttpProviderTransport implements ProviderTransport {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public HttpProviderTransport(ObjectMapper mapper) {
        this(mapper, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    public HttpProviderTransport(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    @Override
    public TransportResponse post(TransportRequest request) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(request.getUrl()))
            .timeout(request.getTimeout())
            .header("Content-Type", "application/json")
            .header("Accept", "text/event-stream")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(request.getPayload())));
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        HttpResponse<Stream<String>> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofLines());
        return new TransportResponse(response.statusCode(), response.body());
    }
}
