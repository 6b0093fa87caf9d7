package com.stockinsight.orchestrator.ai;

/**
 * Connection settings of one AI backend. A provider without an API key is treated as
 * not configured and skipped by the fallback chain.
 */
public record ProviderSettings(String apiKey, String model, String baseUrl) {

    public ProviderSettings {
        apiKey = apiKey == null ? "" : apiKey.trim();
        model = model == null ? "" : model.trim();
        baseUrl = baseUrl == null ? "" : baseUrl.trim();
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    public ProviderSettings withDefaults(String defaultModel, String defaultBaseUrl) {
        return new ProviderSettings(apiKey,
            model.isEmpty() ? defaultModel : model,
            baseUrl.isEmpty() ? defaultBaseUrl : baseUrl);
    }
}
