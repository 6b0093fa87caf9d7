package com.stockinsight.orchestrator.ai;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One AI backend able to turn an analysis prompt into narrative text.
 *
 * <p>Failures are signalled as {@link com.stockinsight.common.exception.AIProviderException}
 * carrying the provider name and an error kind. The token stream is cold and finite;
 * cancelling it releases the underlying connection.
 */
public interface NarrativeProvider {

    String name();

    boolean isConfigured();

    Mono<String> generate(String prompt);

    Flux<String> generateStream(String prompt);
}
