package com.stockinsight.common.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every configured AI provider failed. Carries the individual failures in the order
 * the providers were tried.
 */
public class NarrativeUnavailableException extends AnalysisException {
    private final List<AIProviderException> failures;

    public NarrativeUnavailableException(List<AIProviderException> failures) {
        super("ai", describe(failures));
        this.failures = List.copyOf(failures);
        this.failures.forEach(this::addSuppressed);
    }

    public List<AIProviderException> getFailures() {
        return failures;
    }

    private static String describe(List<AIProviderException> failures) {
        if (failures.isEmpty()) return "No AI provider configured";
        return "All AI providers failed: " + failures.stream()
            .map(f -> f.getProvider() + "=" + f.getKind())
            .collect(Collectors.joining(", "));
    }
}
