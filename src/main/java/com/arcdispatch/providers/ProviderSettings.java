package com.arcdispatch.providers;

import com.arcdispatch.AppLogger;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Registry of configured provider endpoints keyed by lower-cased provider id.
 */
public class ProviderSettings {

    public static final String DEFAULT_RESOURCE = "/providers.json";

    private final Map<String, ProviderEndpointConfig> endpoints = new LinkedHashMap<>();

    public ProviderSettings(List<ProviderEndpointConfig> configs) {
        for (ProviderEndpointConfig config : configs) {
            if (config.getName() == null || config.getName().isBlank()) {
                throw new IllegalArgumentException("Provider entry without a name");
            }
            if (config.getProtocol() == null || config.getProtocol().isBlank()) {
                throw new IllegalArgumentException("Provider " + config.getName() + " has no protocol");
            }
            endpoints.put(normalize(config.getName()), config);
        }
    }

    /**
     * Load from {@code file} when given and present, otherwise from the bundled classpath default.
     */
    public static ProviderSettings load(Path file, ObjectMapper mapper) throws IOException {
        if (file != null && Files.exists(file)) {
            AppLogger.get().info("[ProviderSettings] Loading providers from " + file);
            try (InputStream in = Files.newInputStream(file)) {
                return new ProviderSettings(mapper.readValue(in, ProviderFile.class).getProviders());
            }
        }
        try (InputStream in = ProviderSettings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing bundled " + DEFAULT_RESOURCE);
            }
            return new ProviderSettings(mapper.readValue(in, ProviderFile.class).getProviders());
        }
    }

    public ProviderEndpointConfig find(String providerId) {
        if (providerId == null) {
            return null;
        }
        return endpoints.get(normalize(providerId));
    }

    public ProviderEndpointConfig require(String providerId) {
        ProviderEndpointConfig config = find(providerId);
        if (config == null) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        return config;
    }

    public Collection<ProviderEndpointConfig> all() {
        return Collections.unmodifiableCollection(endpoints.values());
    }

    public static String normalize(String providerId) {
        return providerId.trim().toLowerCase(Locale.ROOT);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderFile {
        private List<ProviderEndpointConfig> providers = new ArrayList<>();

        public List<ProviderEndpointConfig> getProviders() {
            return providers;
        }

        public void setProviders(List<ProviderEndpointConfig> providers) {
            this.providers = providers != null ? providers : new ArrayList<>();
        }
    }
}
