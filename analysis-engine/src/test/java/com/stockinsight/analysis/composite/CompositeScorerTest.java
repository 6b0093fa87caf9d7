package com.stockinsight.analysis.composite;

import com.stockinsight.common.config.RecommendationThresholds;
import com.stockinsight.common.config.ScoringWeights;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.Recommendation;
import com.stockinsight.common.model.ScoreResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CompositeScorerTest {

    private final CompositeScorer scorer =
        new CompositeScorer(ScoringWeights.defaults(), RecommendationThresholds.defaults());

    private static Map<DataCategory, Double> all(double score) {
        return Map.of(DataCategory.PRICE, score, DataCategory.FUNDAMENTAL, score, DataCategory.NEWS, score);
    }

    @Nested
    @DisplayName("full data")
    class FullData {

        @Test
        @DisplayName("all sub-scores 100 → composite 100, all 0 → composite 0, for any valid weights")
        void extremes() {
            for (ScoringWeights w : List.of(ScoringWeights.defaults(), new ScoringWeights(0.1, 0.7, 0.2),
                    new ScoringWeights(1.0 / 3, 1.0 / 3, 1.0 / 3), new ScoringWeights(0, 0, 1))) {
                CompositeScorer s = new CompositeScorer(w, RecommendationThresholds.defaults());
                ScoreResult top = s.combine(all(100));
                ScoreResult bottom = s.combine(all(0));
                assertEquals(100.0, top.composite(), 1e-9);
                assertEquals(Recommendation.STRONG_BUY, top.recommendation());
                assertEquals(0.0, bottom.composite(), 1e-9);
                assertEquals(Recommendation.STRONG_SELL, bottom.recommendation());
            }
        }

        @Test
        @DisplayName("composite is the weighted sum of the sub-scores")
        void weightedSum() {
            ScoreResult r = scorer.combine(Map.of(
                DataCategory.PRICE, 70.0, DataCategory.FUNDAMENTAL, 50.0, DataCategory.NEWS, 40.0));
            assertEquals(0.4 * 70 + 0.4 * 50 + 0.2 * 40, r.composite(), 1e-9);
            assertEquals(Recommendation.HOLD, r.recommendation());
            assertFalse(r.isPartial());
        }
    }

    @Nested
    @DisplayName("partial data")
    class PartialData {

        @Test
        @DisplayName("missing fundamental → weights renormalised and disclosed")
        void renormalised() {
            ScoreResult r = scorer.combine(Map.of(DataCategory.PRICE, 80.0, DataCategory.NEWS, 50.0));
            assertEquals(70.0, r.composite(), 1e-9);
            assertEquals(Recommendation.BUY, r.recommendation());
            assertTrue(r.isPartial());
            assertEquals(Set.of(DataCategory.FUNDAMENTAL), r.missingCategories());
            assertNull(r.fundamental());
            assertEquals(2.0 / 3.0, r.effectiveWeights().get(DataCategory.PRICE), 1e-9);
        }

        @Test
        @DisplayName("nothing present → cannot combine")
        void nothingPresent() {
            assertFalse(scorer.canCombine(Map.of()));
            assertThrows(IllegalArgumentException.class, () -> scorer.combine(Map.of()));
        }

        @Test
        @DisplayName("only zero-weight categories present → cannot combine")
        void zeroWeightOnly() {
            CompositeScorer s = new CompositeScorer(new ScoringWeights(0.5, 0.5, 0), RecommendationThresholds.defaults());
            assertFalse(s.canCombine(Map.of(DataCategory.NEWS, 60.0)));
        }
    }

    @Test
    @DisplayName("sub-score outside [0, 100] is rejected")
    void outOfRange() {
        assertThrows(IllegalArgumentException.class, () -> scorer.combine(Map.of(DataCategory.PRICE, 101.0)));
    }
}
