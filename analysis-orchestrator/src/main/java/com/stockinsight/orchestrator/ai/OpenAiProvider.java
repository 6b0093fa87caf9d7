package com.stockinsight.orchestrator.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

public class OpenAiProvider extends OpenAiCompatibleProvider {

    public static final String NAME = "openai";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public OpenAiProvider(ProviderSettings settings, AiSettings aiSettings,
                          WebClient webClient, ObjectMapper objectMapper) {
        super(settings, aiSettings, webClient, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }
}
