package com.stockinsight.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockinsight.common.exception.AIProviderException;
import com.stockinsight.common.exception.AIProviderException.ErrorKind;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API. Streamed text arrives in {@code content_block_delta} events and
 * the stream ends with {@code message_stop}.
 */
public class AnthropicProvider extends HttpNarrativeProvider {

    public static final String NAME = "anthropic";
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String DEFAULT_MODEL = "claude-3-5-haiku-latest";
    static final String API_VERSION = "2023-06-01";

    public AnthropicProvider(ProviderSettings settings, AiSettings aiSettings,
                             WebClient webClient, ObjectMapper objectMapper) {
        super(settings, aiSettings, webClient, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected WebClient.RequestBodySpec prepare(WebClient.RequestBodyUriSpec request) {
        return request.uri("/v1/messages")
            .header("x-api-key", settings.apiKey())
            .header("anthropic-version", API_VERSION);
    }

    @Override
    protected Map<String, Object> requestBody(String prompt, boolean stream) {
        return Map.of(
            "model", settings.model(),
            "max_tokens", aiSettings.maxTokens(),
            "temperature", Math.min(aiSettings.temperature(), 1.0),
            "stream", stream,
            "system", SYSTEM_PROMPT,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );
    }

    @Override
    protected String extractText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) text.append(block.path("text").asText());
        }
        if (text.length() == 0) throw malformed("no text content block in response");
        return text.toString();
    }

    @Override
    protected boolean isEndOfStream(ServerSentEvent<String> event) {
        return "message_stop".equals(eventType(event));
    }

    @Override
    protected String extractDelta(ServerSentEvent<String> event) {
        String type = eventType(event);
        if ("error".equals(type)) {
            JsonNode error = readTree(event.data()).path("error");
            String errorType = error.path("type").asText("");
            ErrorKind kind = switch (errorType) {
                case "authentication_error", "permission_error" -> ErrorKind.AUTH;
                case "rate_limit_error" -> ErrorKind.QUOTA;
                case "overloaded_error", "api_error" -> ErrorKind.UNAVAILABLE;
                default -> ErrorKind.MALFORMED;
            };
            throw new AIProviderException(NAME, kind, error.path("message").asText(errorType));
        }
        if (!"content_block_delta".equals(type)) return null;
        JsonNode delta = readTree(event.data()).path("delta");
        return delta.path("text").isTextual() ? delta.path("text").asText() : null;
    }

    /** SSE event name, falling back to the {@code type} field of the payload. */
    private String eventType(ServerSentEvent<String> event) {
        if (event.event() != null) return event.event();
        if (event.data() == null || event.data().isBlank()) return "";
        return readTree(event.data()).path("type").asText("");
    }
}
