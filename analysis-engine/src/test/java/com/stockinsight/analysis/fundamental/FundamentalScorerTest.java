package com.stockinsight.analysis.fundamental;

import com.stockinsight.common.exception.ConfigurationException;
import com.stockinsight.common.exception.ScoringException;
import com.stockinsight.common.model.FinancialIndicator;
import com.stockinsight.common.model.FinancialIndicatorSet;
import com.stockinsight.common.model.IndicatorGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FundamentalScorerTest {

    private final FundamentalScorer scorer = new FundamentalScorer(FundamentalScoringProfile.defaults());

    @Nested
    @DisplayName("ScoringCurve")
    class Curve {

        @Test
        @DisplayName("interpolates between points and holds flat outside")
        void interpolation() {
            ScoringCurve curve = ScoringCurve.of(0, 0, 10, 100);
            assertEquals(50.0, curve.score(5), 1e-12);
            assertEquals(0.0, curve.score(-3));
            assertEquals(100.0, curve.score(42));
        }

        @Test
        @DisplayName("parse() reads x:score pairs")
        void parse() {
            assertEquals(ScoringCurve.of(0, 20, 10, 60), ScoringCurve.parse(" 0:20, 10:60 "));
        }

        @Test
        @DisplayName("malformed or non-ascending curves → ConfigurationException")
        void invalid() {
            assertThrows(ConfigurationException.class, () -> ScoringCurve.parse("0-20"));
            assertThrows(ConfigurationException.class, () -> ScoringCurve.parse("abc:1"));
            assertThrows(ConfigurationException.class, () -> ScoringCurve.of(5, 10, 5, 20));
            assertThrows(ConfigurationException.class, () -> ScoringCurve.of(0, 120));
        }
    }

    @Nested
    @DisplayName("score()")
    class Score {

        @Test
        @DisplayName("averages only the present indicators and reports the count")
        void missingExcluded() {
            FundamentalScore s = scorer.score(FinancialIndicatorSet.of("600519", Map.of(
                FinancialIndicator.RETURN_ON_EQUITY, 15.0,
                FinancialIndicator.DEBT_RATIO, 60.0)));

            assertEquals(62.5, s.score(), 1e-9);
            assertEquals(2, s.indicatorsUsed());
            assertEquals(25, s.indicatorsTotal());
            assertEquals(75.0, s.groupScores().get(IndicatorGroup.PROFITABILITY), 1e-9);
            assertEquals(50.0, s.groupScores().get(IndicatorGroup.SOLVENCY), 1e-9);
            assertFalse(s.groupScores().containsKey(IndicatorGroup.GROWTH));
        }

        @Test
        @DisplayName("higher ROE scores higher, higher debt ratio scores lower")
        void curveDirection() {
            double lowRoe = scorer.score(single(FinancialIndicator.RETURN_ON_EQUITY, 5)).score();
            double highRoe = scorer.score(single(FinancialIndicator.RETURN_ON_EQUITY, 20)).score();
            double lowDebt = scorer.score(single(FinancialIndicator.DEBT_RATIO, 30)).score();
            double highDebt = scorer.score(single(FinancialIndicator.DEBT_RATIO, 75)).score();
            assertTrue(highRoe > lowRoe);
            assertTrue(lowDebt > highDebt);
        }

        @Test
        @DisplayName("no indicators → ScoringException")
        void empty() {
            assertThrows(ScoringException.class, () -> scorer.score(FinancialIndicatorSet.empty("AAPL")));
        }

        @Test
        @DisplayName("configured override replaces the default curve")
        void override() {
            FundamentalScorer custom = new FundamentalScorer(FundamentalScoringProfile.defaults()
                .withOverrides(Map.of("return-on-equity", "0:0, 10:100")));
            assertEquals(50.0, custom.score(single(FinancialIndicator.RETURN_ON_EQUITY, 5)).score(), 1e-9);
        }

        @Test
        @DisplayName("override keys resolve the same under a Turkish default locale")
        void overrideKeysIgnoreDefaultLocale() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                FundamentalScorer custom = new FundamentalScorer(FundamentalScoringProfile.defaults()
                    .withOverrides(Map.of("dividend-yield", "0:0, 10:100")));
                assertEquals(50.0, custom.score(single(FinancialIndicator.DIVIDEND_YIELD, 5)).score(), 1e-9);
            } finally {
                Locale.setDefault(previous);
            }
        }

        @Test
        @DisplayName("unknown indicator in overrides → ConfigurationException")
        void unknownOverride() {
            assertThrows(ConfigurationException.class,
                () -> FundamentalScoringProfile.defaults().withOverrides(Map.of("moon-phase", "0:0")));
        }

        @Test
        @DisplayName("every indicator has a default curve")
        void defaultsComplete() {
            assertEquals(FinancialIndicator.COUNT, FundamentalScoringProfile.defaults().curves().size());
        }
    }

    private static FinancialIndicatorSet single(FinancialIndicator indicator, double value) {
        return FinancialIndicatorSet.of("TEST", Map.of(indicator, value));
    }
}
