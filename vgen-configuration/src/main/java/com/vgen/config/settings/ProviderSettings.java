package com.vgen.config.settings;

import com.vgen.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generation backend: profile name ({@code generic-json}, {@code openai-chat}, {@code ollama-chat}),
 * endpoint, model, the environment variable holding the bearer credential, mock switch and request timeout.
 */
public final class ProviderSettings {

    public static final ProviderSettings DEFAULTS = new ProviderSettings(
            "generic-json", "https://api.example.com/generate", "my-model", "LLM_API_KEY", true, 30_000);

    private final String name;
    private final String baseUrl;
    private final String model;
    private final String apiKeyEnv;
    private final boolean mock;
    private final int timeoutMs;

    public ProviderSettings(String name, String baseUrl, String model, String apiKeyEnv, boolean mock, int timeoutMs) {
        this.name = Objects.requireNonNull(name, "name");
        this.baseUrl = baseUrl != null ? baseUrl : "";
        this.model = model != null ? model : "";
        this.apiKeyEnv = apiKeyEnv != null ? apiKeyEnv : "";
        this.mock = mock;
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : DEFAULTS.timeoutMs;
    }

    public static ProviderSettings from(ConfigValue section) {
        return new ProviderSettings(
                section.get("name").asString(DEFAULTS.name),
                section.get("base_url").asString(DEFAULTS.baseUrl),
                section.get("model").asString(DEFAULTS.model),
                section.get("api_key_env").asString(DEFAULTS.apiKeyEnv),
                section.get("mock").asBoolean(DEFAULTS.mock),
                section.get("timeout_ms").asInt(DEFAULTS.timeoutMs));
    }

    public String getName() {
        return name;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }

    public String getApiKeyEnv() {
        return apiKeyEnv;
    }

    public boolean isMock() {
        return mock;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        m.put("base_url", baseUrl);
        m.put("model", model);
        m.put("api_key_env", apiKeyEnv);
        m.put("mock", mock);
        m.put("timeout_ms", timeoutMs);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderSettings that = (ProviderSettings) o;
        return mock == that.mock && timeoutMs == that.timeoutMs
                && name.equals(that.name) && baseUrl.equals(that.baseUrl)
                && model.equals(that.model) && apiKeyEnv.equals(that.apiKeyEnv);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, baseUrl, model, apiKeyEnv, mock, timeoutMs);
    }
}
