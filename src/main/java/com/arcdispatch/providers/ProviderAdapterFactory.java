package com.arcdispatch.providers;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and caches one adapter per configured provider, chosen by the endpoint's protocol.
 */
public class ProviderAdapterFactory {

    private final ObjectMapper mapper;
    private final ProviderTransport transport;
    private final ProviderSettings settings;
    private final Map<String, ProviderAdapter> adapterCache = new ConcurrentHashMap<>();

    public ProviderAdapterFactory(ObjectMapper mapper, ProviderTransport transport, ProviderSettings settings) {
        this.mapper = mapper;
        this.transport = transport;
        this.settings = settings;
    }

    /**
     * @throws IllegalArgumentException for providers that are not configured
     */
    public ProviderAdapter getAdapter(String providerId) {
        ProviderEndpointConfig endpoint = settings.require(providerId);
        return adapterCache.computeIfAbsent(ProviderSettings.normalize(providerId), key -> createAdapter(endpoint));
    }

    public ProviderSettings getSettings() {
        return settings;
    }

    private ProviderAdapter createAdapter(ProviderEndpointConfig endpoint) {
        String protocol = endpoint.getProtocol().trim().toLowerCase();
        switch (protocol) {
            case "responses":
                return new OpenAiResponsesAdapter(mapper, transport, endpoint);
            case "anthropic":
                return new AnthropicMessagesAdapter(mapper, transport, endpoint);
            case "chat":
                return new ChatCompletionsAdapter(mapper, transport, endpoint);
            default:
                throw new IllegalArgumentException("Unsupported protocol '" + endpoint.getProtocol()
                    + "' for provider " + endpoint.getName());
        }
    }
}
