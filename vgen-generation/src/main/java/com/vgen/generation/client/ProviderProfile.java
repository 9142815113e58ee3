package com.vgen.generation.client;

/**
 * Request/response dialect of a generation backend, selected by {@code provider.name}.
 */
public enum ProviderProfile {
    /** {@code {model, temperature, top_p, n, prompt}}; variants in {@code variants} or {@code choices[].text}. */
    GENERIC_JSON("generic-json", true),
    /** OpenAI-compatible chat completions with a JSON response format. */
    OPENAI_CHAT("openai-chat", true),
    /** Ollama {@code /api/chat} with {@code format: json}; no credential needed. */
    OLLAMA_CHAT("ollama-chat", false);

    private final String value;
    private final boolean credentialRequired;

    ProviderProfile(String value, boolean credentialRequired) {
        this.value = value;
        this.credentialRequired = credentialRequired;
    }

    public String toValue() {
        return value;
    }

    public boolean isCredentialRequired() {
        return credentialRequired;
    }

    /**
     * @throws GenerationException for unknown provider names
     */
    public static ProviderProfile fromValue(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (ProviderProfile p : values()) {
                if (p.value.equalsIgnoreCase(normalized)) return p;
            }
        }
        throw new GenerationException("Unknown provider '" + value + "' (expected generic-json, openai-chat or ollama-chat)");
    }
}
