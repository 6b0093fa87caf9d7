package com.stockinsight.orchestrator.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final narrative text and where it came from. {@code source} is a provider name or
 * {@link #RULE_BASED}; {@code interrupted} marks a provider stream that broke off after
 * its first token and was replaced by the rule-based text.
 */
public record Narrative(
    @JsonProperty("source") String source,
    @JsonProperty("text") String text,
    @JsonProperty("interrupted") boolean interrupted
) {
    public static final String RULE_BASED = "rule-based";

    public static Narrative fromProvider(String provider, String text) {
        return new Narrative(provider, text, false);
    }

    public static Narrative ruleBased(String text, boolean interrupted) {
        return new Narrative(RULE_BASED, text, interrupted);
    }

    public boolean isRuleBased() {
        return RULE_BASED.equals(source);
    }
}
