package com.stockinsight.orchestrator.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.stockinsight.common.exception.AIProviderException;
import com.stockinsight.common.exception.AIProviderException.ErrorKind;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps transport and parsing failures of an AI call onto {@link ErrorKind}s.
 */
public final class ProviderErrors {

    private ProviderErrors() {}

    public static AIProviderException classify(String provider, Throwable error) {
        if (error instanceof AIProviderException ai) return ai;
        if (error instanceof WebClientResponseException http) {
            int status = http.getStatusCode().value();
            ErrorKind kind = kindForStatus(status);
            return new AIProviderException(provider, kind, "HTTP " + status, http);
        }
        if (error instanceof TimeoutException) {
            return new AIProviderException(provider, ErrorKind.NETWORK, "timed out", error);
        }
        if (error instanceof JsonProcessingException || error instanceof DecodingException) {
            return new AIProviderException(provider, ErrorKind.MALFORMED, "unreadable response", error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new AIProviderException(provider, ErrorKind.NETWORK, String.valueOf(error.getMessage()), error);
        }
        return new AIProviderException(provider, ErrorKind.UNAVAILABLE, String.valueOf(error.getMessage()), error);
    }

    static ErrorKind kindForStatus(int status) {
        if (status == 401 || status == 403) return ErrorKind.AUTH;
        if (status == 429) return ErrorKind.QUOTA;
        if (status >= 500) return ErrorKind.NETWORK;
        return ErrorKind.MALFORMED;
    }
}
