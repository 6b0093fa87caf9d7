package com.stockinsight.analysis.fundamental;

import com.stockinsight.common.exception.ConfigurationException;
import com.stockinsight.common.model.FinancialIndicator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import static com.stockinsight.common.model.FinancialIndicator.*;

/**
 * One {@link ScoringCurve} per financial indicator. Immutable.
 *
 * <p>Margins, returns, growth rates, debt ratio and dividend yield are in percent;
 * the remaining ratios are plain multiples.
 */
public final class FundamentalScoringProfile {

    private final Map<FinancialIndicator, ScoringCurve> curves;

    private FundamentalScoringProfile(Map<FinancialIndicator, ScoringCurve> curves) {
        this.curves = Collections.unmodifiableMap(new EnumMap<>(curves));
    }

    public static FundamentalScoringProfile defaults() {
        Map<FinancialIndicator, ScoringCurve> c = new EnumMap<>(FinancialIndicator.class);
        // profitability
        c.put(NET_PROFIT_MARGIN,   ScoringCurve.of(-10, 0, 0, 30, 10, 60, 20, 80, 35, 100));
        c.put(RETURN_ON_EQUITY,    ScoringCurve.of(-10, 0, 0, 25, 8, 50, 15, 75, 25, 100));
        c.put(RETURN_ON_ASSETS,    ScoringCurve.of(-5, 0, 0, 30, 5, 60, 10, 85, 15, 100));
        c.put(GROSS_MARGIN,        ScoringCurve.of(0, 10, 20, 40, 40, 70, 60, 90, 80, 100));
        c.put(OPERATING_MARGIN,    ScoringCurve.of(-10, 0, 0, 30, 10, 60, 20, 85, 30, 100));
        // solvency
        c.put(CURRENT_RATIO,       ScoringCurve.of(0.5, 10, 1, 40, 1.5, 70, 2, 90, 3, 100, 6, 80));
        c.put(QUICK_RATIO,         ScoringCurve.of(0.3, 10, 0.8, 50, 1, 70, 1.5, 90, 4, 85));
        c.put(DEBT_RATIO,          ScoringCurve.of(20, 100, 40, 80, 60, 50, 80, 20, 100, 0));
        c.put(DEBT_TO_EQUITY,      ScoringCurve.of(0, 100, 0.5, 85, 1, 65, 2, 35, 4, 0));
        c.put(INTEREST_COVERAGE,   ScoringCurve.of(0, 0, 1.5, 30, 3, 60, 8, 90, 15, 100));
        // efficiency
        c.put(TOTAL_ASSET_TURNOVER,   ScoringCurve.of(0.1, 20, 0.5, 50, 1, 75, 2, 100));
        c.put(INVENTORY_TURNOVER,     ScoringCurve.of(1, 20, 4, 50, 8, 75, 15, 100));
        c.put(RECEIVABLES_TURNOVER,   ScoringCurve.of(2, 20, 6, 50, 12, 80, 20, 100));
        c.put(CURRENT_ASSET_TURNOVER, ScoringCurve.of(0.5, 20, 1, 50, 2, 80, 3, 100));
        c.put(FIXED_ASSET_TURNOVER,   ScoringCurve.of(0.5, 20, 2, 50, 5, 80, 10, 100));
        // growth
        c.put(REVENUE_GROWTH,             ScoringCurve.of(-20, 0, 0, 40, 10, 60, 20, 80, 40, 100));
        c.put(NET_PROFIT_GROWTH,          ScoringCurve.of(-50, 0, 0, 40, 15, 65, 30, 85, 60, 100));
        c.put(TOTAL_ASSET_GROWTH,         ScoringCurve.of(-10, 20, 0, 45, 10, 65, 25, 85, 50, 90));
        c.put(EQUITY_GROWTH,              ScoringCurve.of(-10, 10, 0, 40, 10, 65, 20, 85, 40, 100));
        c.put(OPERATING_CASH_FLOW_GROWTH, ScoringCurve.of(-50, 0, 0, 40, 20, 70, 50, 100));
        // valuation: loss-making companies report a non-positive P/E
        c.put(PE_RATIO,       ScoringCurve.of(0, 5, 5, 80, 15, 90, 25, 70, 40, 45, 80, 15, 150, 5));
        c.put(PB_RATIO,       ScoringCurve.of(0, 50, 1, 90, 2, 75, 4, 50, 8, 20, 15, 5));
        c.put(PS_RATIO,       ScoringCurve.of(0.5, 95, 1, 85, 3, 60, 6, 35, 10, 15, 20, 5));
        c.put(PEG_RATIO,      ScoringCurve.of(0, 30, 0.5, 95, 1, 80, 1.5, 60, 2, 40, 3, 15));
        c.put(DIVIDEND_YIELD, ScoringCurve.of(0, 30, 1, 50, 3, 80, 5, 95, 8, 80));
        return new FundamentalScoringProfile(c);
    }

    /**
     * Replaces the curves named in {@code overrides}. Keys are indicator names in any case,
     * with {@code -} or {@code _} separators; values use {@link ScoringCurve#parse} syntax.
     */
    public FundamentalScoringProfile withOverrides(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        Map<FinancialIndicator, ScoringCurve> c = new EnumMap<>(curves);
        overrides.forEach((name, definition) -> {
            FinancialIndicator indicator;
            try {
                indicator = FinancialIndicator.valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown financial indicator in scoring curves: " + name, e);
            }
            c.put(indicator, ScoringCurve.parse(definition));
        });
        return new FundamentalScoringProfile(c);
    }

    public ScoringCurve curve(FinancialIndicator indicator) {
        ScoringCurve curve = curves.get(indicator);
        if (curve == null) throw new ConfigurationException("No scoring curve for " + indicator);
        return curve;
    }

    public Map<FinancialIndicator, ScoringCurve> curves() {
        return curves;
    }
}
