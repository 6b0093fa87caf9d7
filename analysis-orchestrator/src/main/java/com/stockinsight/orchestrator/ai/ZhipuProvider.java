package com.stockinsight.orchestrator.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Zhipu GLM models, served through an OpenAI-compatible chat-completions endpoint.
 */
public class ZhipuProvider extends OpenAiCompatibleProvider {

    public static final String NAME = "zhipu";
    public static final String DEFAULT_BASE_URL = "https://open.bigmodel.cn/api/paas/v4";
    public static final String DEFAULT_MODEL = "glm-4-flash";

    public ZhipuProvider(ProviderSettings settings, AiSettings aiSettings,
                         WebClient webClient, ObjectMapper objectMapper) {
        super(settings, aiSettings, webClient, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }
}
