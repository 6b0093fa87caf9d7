package com.stockinsight.common.model;

/**
 * Fixed vocabulary of the 25 financial indicators, five per {@link IndicatorGroup}.
 * Ratios and margins are expressed in percent, turnover figures as times per year.
 */
public enum FinancialIndicator {
    NET_PROFIT_MARGIN(IndicatorGroup.PROFITABILITY),
    RETURN_ON_EQUITY(IndicatorGroup.PROFITABILITY),
    RETURN_ON_ASSETS(IndicatorGroup.PROFITABILITY),
    GROSS_MARGIN(IndicatorGroup.PROFITABILITY),
    OPERATING_MARGIN(IndicatorGroup.PROFITABILITY),

    CURRENT_RATIO(IndicatorGroup.SOLVENCY),
    QUICK_RATIO(IndicatorGroup.SOLVENCY),
    DEBT_RATIO(IndicatorGroup.SOLVENCY),
    DEBT_TO_EQUITY(IndicatorGroup.SOLVENCY),
    INTEREST_COVERAGE(IndicatorGroup.SOLVENCY),

    TOTAL_ASSET_TURNOVER(IndicatorGroup.EFFICIENCY),
    INVENTORY_TURNOVER(IndicatorGroup.EFFICIENCY),
    RECEIVABLES_TURNOVER(IndicatorGroup.EFFICIENCY),
    CURRENT_ASSET_TURNOVER(IndicatorGroup.EFFICIENCY),
    FIXED_ASSET_TURNOVER(IndicatorGroup.EFFICIENCY),

    REVENUE_GROWTH(IndicatorGroup.GROWTH),
    NET_PROFIT_GROWTH(IndicatorGroup.GROWTH),
    TOTAL_ASSET_GROWTH(IndicatorGroup.GROWTH),
    EQUITY_GROWTH(IndicatorGroup.GROWTH),
    OPERATING_CASH_FLOW_GROWTH(IndicatorGroup.GROWTH),

    PE_RATIO(IndicatorGroup.VALUATION),
    PB_RATIO(IndicatorGroup.VALUATION),
    PS_RATIO(IndicatorGroup.VALUATION),
    PEG_RATIO(IndicatorGroup.VALUATION),
    DIVIDEND_YIELD(IndicatorGroup.VALUATION);

    public static final int COUNT = values().length;

    private final IndicatorGroup group;

    FinancialIndicator(IndicatorGroup group) {
        this.group = group;
    }

    public IndicatorGroup group() { return group; }
}
