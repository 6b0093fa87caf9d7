package com.stockinsight.common.config;

import com.stockinsight.common.exception.ConfigurationException;
import com.stockinsight.common.model.DataCategory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Weights of the technical, fundamental and sentiment sub-scores in the composite.
 *
 * <p>Each weight must lie in [0, 1] and the three must sum to 1.0 within {@link #EPSILON}.
 * Violations raise {@link ConfigurationException} at construction, so an invalid
 * configuration never reaches request handling.
 */
public record ScoringWeights(double technical, double fundamental, double sentiment) {

    public static final double EPSILON = 1e-6;

    public ScoringWeights {
        requireUnit("technical", technical);
        requireUnit("fundamental", fundamental);
        requireUnit("sentiment", sentiment);
        double sum = technical + fundamental + sentiment;
        if (Math.abs(sum - 1.0) > EPSILON) {
            throw new ConfigurationException(String.format(
                "Scoring weights must sum to 1.0 but sum to %.6f (technical=%.4f fundamental=%.4f sentiment=%.4f)",
                sum, technical, fundamental, sentiment));
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.4, 0.4, 0.2);
    }

    public double weightOf(DataCategory category) {
        return switch (category) {
            case PRICE       -> technical;
            case FUNDAMENTAL -> fundamental;
            case NEWS        -> sentiment;
        };
    }

    /**
     * Renormalises the weights over the given categories so they sum to 1.0.
     * Returns an empty map when none of the categories carries weight.
     */
    public Map<DataCategory, Double> renormalisedOver(Set<DataCategory> available) {
        Map<DataCategory, Double> result = new EnumMap<>(DataCategory.class);
        double total = 0.0;
        for (DataCategory c : available) total += weightOf(c);
        if (total <= 0.0) return result;
        for (DataCategory c : available) result.put(c, weightOf(c) / total);
        return result;
    }

    private static void requireUnit(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException("Scoring weight '" + name + "' must be within [0, 1] but was " + value);
        }
    }
}
