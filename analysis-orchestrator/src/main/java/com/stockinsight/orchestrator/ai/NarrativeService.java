package com.stockinsight.orchestrator.ai;

import com.stockinsight.common.exception.AIProviderException;
import com.stockinsight.common.exception.AIProviderException.ErrorKind;
import com.stockinsight.common.exception.NarrativeUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered fallback over the configured {@link NarrativeProvider}s.
 *
 * <p>Providers are tried in configuration order; a provider failure moves on to the next
 * one. When every provider fails (or none is configured) the caller receives a
 * {@link NarrativeUnavailableException} listing each failure. In streaming mode fallback
 * only happens before the first token: once a provider has emitted text its failure is
 * passed through as-is, since tokens already delivered cannot be taken back.
 */
public class NarrativeService {

    private static final Logger log = LoggerFactory.getLogger(NarrativeService.class);

    private final List<NarrativeProvider> chain;

    public NarrativeService(List<NarrativeProvider> providers) {
        this.chain = providers.stream().filter(NarrativeProvider::isConfigured).toList();
        log.info("[NarrativeService] provider chain={}", configuredProviders());
    }

    public List<String> configuredProviders() {
        return chain.stream().map(NarrativeProvider::name).toList();
    }

    public boolean hasProviders() {
        return !chain.isEmpty();
    }

    public Mono<Narrative> generate(String prompt) {
        return Mono.defer(() -> attempt(0, prompt, new ArrayList<>()));
    }

    public Flux<NarrativeToken> streamNarrative(String prompt) {
        return Flux.defer(() -> attemptStream(0, prompt, new ArrayList<>()));
    }

    private Mono<Narrative> attempt(int index, String prompt, List<AIProviderException> failures) {
        if (index >= chain.size()) return Mono.error(new NarrativeUnavailableException(failures));
        NarrativeProvider provider = chain.get(index);
        return provider.generate(prompt)
            .filter(text -> !text.isBlank())
            .switchIfEmpty(Mono.error(() -> emptyResponse(provider)))
            .map(text -> Narrative.fromProvider(provider.name(), text))
            .onErrorResume(e -> {
                AIProviderException failure = ProviderErrors.classify(provider.name(), e);
                logFallback(provider, failure, index);
                failures.add(failure);
                return attempt(index + 1, prompt, failures);
            });
    }

    private Flux<NarrativeToken> attemptStream(int index, String prompt, List<AIProviderException> failures) {
        if (index >= chain.size()) return Flux.error(new NarrativeUnavailableException(failures));
        NarrativeProvider provider = chain.get(index);
        AtomicBoolean emitted = new AtomicBoolean();
        return provider.generateStream(prompt)
            .map(text -> new NarrativeToken(provider.name(), text))
            .doOnNext(token -> emitted.set(true))
            .switchIfEmpty(Flux.error(() -> emptyResponse(provider)))
            .onErrorResume(e -> {
                AIProviderException failure = ProviderErrors.classify(provider.name(), e);
                if (emitted.get()) {
                    log.warn("[NarrativeService] stream interrupted provider={} kind={}",
                        provider.name(), failure.getKind());
                    return Flux.error(failure);
                }
                logFallback(provider, failure, index);
                failures.add(failure);
                return attemptStream(index + 1, prompt, failures);
            });
    }

    private void logFallback(NarrativeProvider provider, AIProviderException failure, int index) {
        String next = index + 1 < chain.size() ? chain.get(index + 1).name() : "none";
        log.warn("[NarrativeService] AI_PROVIDER_FAILED provider={} kind={} next={} reason={}",
            provider.name(), failure.getKind(), next, failure.getMessage());
    }

    private static AIProviderException emptyResponse(NarrativeProvider provider) {
        return new AIProviderException(provider.name(), ErrorKind.MALFORMED, "empty response");
    }
}
