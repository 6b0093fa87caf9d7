package com.stockinsight.orchestrator.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockinsight.common.exception.AIProviderException;
import com.stockinsight.common.exception.AIProviderException.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Shared plumbing of the HTTP backends: request serialisation, timeout, SSE decoding and
 * error classification. Subclasses describe their wire format only.
 */
public abstract class HttpNarrativeProvider implements NarrativeProvider {

    protected static final String SYSTEM_PROMPT =
        "You are a professional equity analyst. Write a structured, balanced investment "
        + "analysis in Markdown based strictly on the data provided.";

    private static final Logger log = LoggerFactory.getLogger(HttpNarrativeProvider.class);

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    protected final ProviderSettings settings;
    protected final AiSettings aiSettings;
    protected final ObjectMapper objectMapper;
    private final WebClient webClient;

    protected HttpNarrativeProvider(ProviderSettings settings, AiSettings aiSettings,
                                    WebClient webClient, ObjectMapper objectMapper) {
        this.settings = settings;
        this.aiSettings = aiSettings;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured() {
        return settings.hasApiKey();
    }

    @Override
    public Mono<String> generate(String prompt) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(prompt, false)))
            .flatMap(body -> prepare(webClient.post())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class))
            .timeout(aiSettings.timeout())
            .map(response -> extractText(readTree(response)))
            .doOnSuccess(text -> log.debug("[{}] generated chars={}", name(), text == null ? 0 : text.length()))
            .onErrorMap(e -> ProviderErrors.classify(name(), e));
    }

    /** Text chunks in arrival order; empty chunks are skipped. */
    @Override
    public Flux<String> generateStream(String prompt) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(prompt, true)))
            .flatMapMany(body -> prepare(webClient.post())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(body)
                .retrieve()
                .bodyToFlux(SSE_TYPE))
            .timeout(aiSettings.timeout())
            .takeWhile(event -> !isEndOfStream(event))
            .<String>handle((event, sink) -> {
                String delta = extractDelta(event);
                if (delta != null && !delta.isEmpty()) sink.next(delta);
            })
            .onErrorMap(e -> ProviderErrors.classify(name(), e));
    }

    /** Sets the path and authentication headers of a chat request. */
    protected abstract WebClient.RequestBodySpec prepare(WebClient.RequestBodyUriSpec request);

    protected abstract Map<String, Object> requestBody(String prompt, boolean stream);

    /** Narrative text of a complete, non-streamed response. */
    protected abstract String extractText(JsonNode response);

    protected abstract boolean isEndOfStream(ServerSentEvent<String> event);

    /** Text carried by one stream event, or {@code null} for control events. */
    protected abstract String extractDelta(ServerSentEvent<String> event);

    protected JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AIProviderException(name(), ErrorKind.MALFORMED, "response is not JSON", e);
        }
    }

    protected AIProviderException malformed(String message) {
        return new AIProviderException(name(), ErrorKind.MALFORMED, message);
    }
}
