package com.stockinsight.common.config;

import com.stockinsight.common.exception.ConfigurationException;
import com.stockinsight.common.model.Recommendation;

/**
 * Lower bounds of each recommendation band on the 0–100 composite scale.
 *
 * <pre>
 *   composite ≥ strongBuy → STRONG_BUY
 *   composite ≥ buy       → BUY
 *   composite ≥ hold      → HOLD
 *   composite ≥ sell      → SELL
 *   otherwise             → STRONG_SELL
 * </pre>
 *
 * The bounds must satisfy {@code 0 < sell < hold < buy < strongBuy ≤ 100}, which makes the
 * five bands a gap-free, non-overlapping partition of [0, 100].
 */
public record RecommendationThresholds(double strongBuy, double buy, double hold, double sell) {

    public RecommendationThresholds {
        if (!(Double.isFinite(strongBuy) && Double.isFinite(buy)
                && Double.isFinite(hold) && Double.isFinite(sell))) {
            throw new ConfigurationException("Recommendation thresholds must be finite numbers");
        }
        if (!(0.0 < sell && sell < hold && hold < buy && buy < strongBuy && strongBuy <= 100.0)) {
            throw new ConfigurationException(String.format(
                "Recommendation thresholds must satisfy 0 < sell < hold < buy < strongBuy <= 100 "
                    + "(strongBuy=%.2f buy=%.2f hold=%.2f sell=%.2f)", strongBuy, buy, hold, sell));
        }
    }

    public static RecommendationThresholds defaults() {
        return new RecommendationThresholds(80.0, 60.0, 40.0, 20.0);
    }

    /**
     * Maps a composite score to exactly one recommendation.
     *
     * @throws IllegalArgumentException if {@code composite} is outside [0, 100] or not a number
     */
    public Recommendation classify(double composite) {
        if (Double.isNaN(composite) || composite < 0.0 || composite > 100.0) {
            throw new IllegalArgumentException("Composite score must be within [0, 100] but was " + composite);
        }
        if (composite >= strongBuy) return Recommendation.STRONG_BUY;
        if (composite >= buy)       return Recommendation.BUY;
        if (composite >= hold)      return Recommendation.HOLD;
        if (composite >= sell)      return Recommendation.SELL;
        return Recommendation.STRONG_SELL;
    }
}
