package com.stockinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Sub-scores, composite score and recommendation for one analysis.
 *
 * <p>A sub-score is {@code null} when its category could not be scored. In that case
 * the category appears in {@code missingCategories} and {@code effectiveWeights} holds
 * the renormalised weights actually used for the composite, so
 * {@code composite = Σ effectiveWeight × subScore} over the present categories.
 */
public record ScoreResult(
    @JsonProperty("technical") Double technical,
    @JsonProperty("fundamental") Double fundamental,
    @JsonProperty("sentiment") Double sentiment,
    @JsonProperty("composite") double composite,
    @JsonProperty("recommendation") Recommendation recommendation,
    @JsonProperty("effectiveWeights") Map<DataCategory, Double> effectiveWeights,
    @JsonProperty("missingCategories") Set<DataCategory> missingCategories
) {
    public ScoreResult {
        effectiveWeights = effectiveWeights == null || effectiveWeights.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(effectiveWeights));
        missingCategories = missingCategories == null || missingCategories.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(missingCategories));
    }

    @JsonProperty("partial")
    public boolean isPartial() {
        return !missingCategories.isEmpty();
    }

    public Double subScore(DataCategory category) {
        return switch (category) {
            case PRICE       -> technical;
            case FUNDAMENTAL -> fundamental;
            case NEWS        -> sentiment;
        };
    }
}
