package com.stockinsight.orchestrator.ai;

import com.stockinsight.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Settings shared by every AI backend plus the order in which backends are tried.
 */
public record AiSettings(List<String> providerOrder, int maxTokens, double temperature, Duration timeout) {

    public AiSettings {
        providerOrder = providerOrder == null ? List.of() : providerOrder.stream()
            .map(p -> p.trim().toLowerCase(Locale.ROOT))
            .filter(p -> !p.isEmpty())
            .distinct()
            .toList();
        if (maxTokens <= 0) throw new ConfigurationException("ai.max-tokens must be positive: " + maxTokens);
        if (!(temperature >= 0.0 && temperature <= 2.0)) {
            throw new ConfigurationException("ai.temperature must be within [0, 2]: " + temperature);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("ai.timeout must be positive: " + timeout);
        }
    }

    public static AiSettings defaults() {
        return new AiSettings(List.of("openai", "anthropic", "zhipu"), 4000, 0.7, Duration.ofSeconds(60));
    }
}
