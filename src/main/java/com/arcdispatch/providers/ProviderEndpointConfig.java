package com.arcdispatch.providers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * One configured provider endpoint, as read from {@code providers.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderEndpointConfig {

    public static final long DEFAULT_TIMEOUT_MS = 30L * 60L * 1000L;

    private String name;
    private String protocol;
    private String baseUrl;
    private String apiKeyEnv;
    private Long timeoutMs;
    private Integer maxOutputTokens;
    private Integer maxConcurrent;
    private Map<String, String> extraHeaders = new LinkedHashMap<>();

    @JsonIgnore
    private Function<String, String> environment = System::getenv;

    public ProviderEndpointConfig() {
    }

    public ProviderEndpointConfig(String name, String protocol, String baseUrl) {
        this.name = name;
        this.protocol = protocol;
        this.baseUrl = baseUrl;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKeyEnv() {
        return apiKeyEnv;
    }

    public void setApiKeyEnv(String apiKeyEnv) {
        this.apiKeyEnv = apiKeyEnv;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    @JsonIgnore
    public long getEffectiveTimeoutMs() {
        return timeoutMs != null && timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(Integer maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public Integer getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(Integer maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    @JsonIgnore
    public int getEffectiveMaxConcurrent() {
        return maxConcurrent != null && maxConcurrent > 0 ? maxConcurrent : 1;
    }

    public Map<String, String> getExtraHeaders() {
        return extraHeaders;
    }

    public void setExtraHeaders(Map<String, String> extraHeaders) {
        this.extraHeaders = extraHeaders != null ? extraHeaders : new LinkedHashMap<>();
    }

    /**
     * Override where the API key is looked up. Tests use this instead of real environment variables.
     */
    public void setEnvironment(Function<String, String> environment) {
        this.environment = environment != null ? environment : System::getenv;
    }

    /**
     * API key from the configured environment variable, or null when unset.
     */
    @JsonIgnore
    public String resolveApiKey() {
        if (apiKeyEnv == null || apiKeyEnv.isBlank()) {
            return null;
        }
        String value = environment.apply(apiKeyEnv.trim());
        return value == null || value.isBlank() ? null : value.trim();
    }
}
