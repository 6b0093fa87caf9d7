package com.stockinsight.analysis.fundamental;

import com.stockinsight.common.exception.ScoringException;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.FinancialIndicator;
import com.stockinsight.common.model.FinancialIndicatorSet;
import com.stockinsight.common.model.IndicatorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Averages the curve scores of the indicators present in a {@link FinancialIndicatorSet}.
 * Absent indicators are left out of the average instead of counting as zero.
 */
public class FundamentalScorer {

    private static final Logger log = LoggerFactory.getLogger(FundamentalScorer.class);

    private final FundamentalScoringProfile profile;

    public FundamentalScorer(FundamentalScoringProfile profile) {
        this.profile = profile;
    }

    /**
     * @throws ScoringException when the set carries none of the indicators
     */
    public FundamentalScore score(FinancialIndicatorSet indicators) {
        if (indicators == null || indicators.presentCount() == 0) {
            throw new ScoringException(DataCategory.FUNDAMENTAL, "No financial indicators available"
                + (indicators == null ? "" : " symbol=" + indicators.symbol()));
        }

        Map<FinancialIndicator, Double> partial = new EnumMap<>(FinancialIndicator.class);
        Map<IndicatorGroup, double[]> groups = new EnumMap<>(IndicatorGroup.class);
        double sum = 0;
        for (FinancialIndicator indicator : FinancialIndicator.values()) {
            OptionalDouble value = indicators.get(indicator);
            if (value.isEmpty()) continue;
            double s = profile.curve(indicator).score(value.getAsDouble());
            partial.put(indicator, s);
            sum += s;
            double[] acc = groups.computeIfAbsent(indicator.group(), g -> new double[2]);
            acc[0] += s;
            acc[1]++;
        }

        Map<IndicatorGroup, Double> groupScores = new EnumMap<>(IndicatorGroup.class);
        groups.forEach((group, acc) -> groupScores.put(group, acc[0] / acc[1]));

        double score = sum / partial.size();
        log.debug("[FundamentalScorer] symbol={} used={}/{} score={}",
            indicators.symbol(), partial.size(), FinancialIndicator.COUNT, String.format("%.2f", score));
        return new FundamentalScore(score, partial.size(), FinancialIndicator.COUNT, partial, groupScores);
    }
}
