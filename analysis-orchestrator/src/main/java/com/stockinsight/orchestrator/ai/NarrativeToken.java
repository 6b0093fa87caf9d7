package com.stockinsight.orchestrator.ai;

/** A text chunk of a streamed narrative, tagged with the provider producing it. */
public record NarrativeToken(String provider, String text) {}
