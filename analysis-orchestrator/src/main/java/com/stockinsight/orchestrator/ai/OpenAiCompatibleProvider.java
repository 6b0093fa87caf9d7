package com.stockinsight.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockinsight.common.exception.AIProviderException;
import com.stockinsight.common.exception.AIProviderException.ErrorKind;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Chat-completions wire format: {@code choices[0].message.content} for complete responses,
 * {@code choices[0].delta.content} per stream chunk and a {@code [DONE]} sentinel.
 */
public abstract class OpenAiCompatibleProvider extends HttpNarrativeProvider {

    static final String DONE = "[DONE]";

    protected OpenAiCompatibleProvider(ProviderSettings settings, AiSettings aiSettings,
                                       WebClient webClient, ObjectMapper objectMapper) {
        super(settings, aiSettings, webClient, objectMapper);
    }

    @Override
    protected WebClient.RequestBodySpec prepare(WebClient.RequestBodyUriSpec request) {
        return request.uri("/chat/completions")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey());
    }

    @Override
    protected Map<String, Object> requestBody(String prompt, boolean stream) {
        return Map.of(
            "model", settings.model(),
            "max_tokens", aiSettings.maxTokens(),
            "temperature", aiSettings.temperature(),
            "stream", stream,
            "messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt))
        );
    }

    @Override
    protected String extractText(JsonNode response) {
        failOnErrorBody(response);
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw malformed("no choices[0].message.content in response");
        }
        return content.asText();
    }

    @Override
    protected boolean isEndOfStream(ServerSentEvent<String> event) {
        return event.data() != null && DONE.equals(event.data().trim());
    }

    @Override
    protected String extractDelta(ServerSentEvent<String> event) {
        String data = event.data();
        if (data == null || data.isBlank()) return null;
        JsonNode chunk = readTree(data);
        failOnErrorBody(chunk);
        JsonNode content = chunk.path("choices").path(0).path("delta").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    private void failOnErrorBody(JsonNode node) {
        JsonNode error = node.path("error");
        if (error.isMissingNode() || error.isNull()) return;
        String code = error.path("code").asText("");
        ErrorKind kind = code.contains("quota") || code.contains("rate") ? ErrorKind.QUOTA : ErrorKind.UNAVAILABLE;
        throw new AIProviderException(name(), kind, error.path("message").asText("error response"));
    }
}
