package com.stockinsight.analysis.composite;

import com.stockinsight.common.config.RecommendationThresholds;
import com.stockinsight.common.config.ScoringWeights;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.Recommendation;
import com.stockinsight.common.model.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Weighted blend of the sub-scores into the composite and its recommendation.
 *
 * <p>With every category present the configured weights apply as-is. When categories are
 * missing the weights of the present ones are rescaled to sum to 1.0; the rescaled
 * weights and the missing categories are carried in the {@link ScoreResult}.
 */
public class CompositeScorer {

    private static final Logger log = LoggerFactory.getLogger(CompositeScorer.class);

    private final ScoringWeights weights;
    private final RecommendationThresholds thresholds;

    public CompositeScorer(ScoringWeights weights, RecommendationThresholds thresholds) {
        this.weights = weights;
        this.thresholds = thresholds;
    }

    public ScoringWeights weights() {
        return weights;
    }

    /** True when at least one present category carries a non-zero weight. */
    public boolean canCombine(Map<DataCategory, Double> subScores) {
        return !weights.renormalisedOver(present(subScores)).isEmpty();
    }

    /**
     * @param subScores 0–100 sub-scores of the categories that could be scored
     * @throws IllegalArgumentException if {@link #canCombine} is false or a score is outside [0, 100]
     */
    public ScoreResult combine(Map<DataCategory, Double> subScores) {
        Set<DataCategory> present = present(subScores);
        Map<DataCategory, Double> effective = weights.renormalisedOver(present);
        if (effective.isEmpty()) {
            throw new IllegalArgumentException("No weighted sub-score to combine, present=" + present);
        }

        double composite = 0;
        for (Map.Entry<DataCategory, Double> e : effective.entrySet()) {
            double score = subScores.get(e.getKey());
            if (!(score >= 0.0 && score <= 100.0)) {
                throw new IllegalArgumentException("Sub-score " + e.getKey() + " outside [0, 100]: " + score);
            }
            composite += e.getValue() * score;
        }
        composite = Math.max(0.0, Math.min(100.0, composite));
        Recommendation recommendation = thresholds.classify(composite);

        Set<DataCategory> missing = EnumSet.allOf(DataCategory.class);
        missing.removeAll(present);

        log.debug("[CompositeScorer] composite={} recommendation={} missing={}",
            String.format("%.2f", composite), recommendation, missing);

        return new ScoreResult(
            subScores.get(DataCategory.PRICE),
            subScores.get(DataCategory.FUNDAMENTAL),
            subScores.get(DataCategory.NEWS),
            composite, recommendation, effective, missing);
    }

    private static Set<DataCategory> present(Map<DataCategory, Double> subScores) {
        Set<DataCategory> present = EnumSet.noneOf(DataCategory.class);
        if (subScores == null) return present;
        subScores.forEach((c, v) -> {
            if (c != null && v != null) present.add(c);
        });
        return present;
    }
}
