package com.stockinsight.common.model;

public enum IndicatorGroup {
    PROFITABILITY,
    SOLVENCY,
    EFFICIENCY,
    GROWTH,
    VALUATION
}
