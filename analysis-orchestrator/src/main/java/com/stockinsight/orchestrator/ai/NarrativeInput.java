package com.stockinsight.orchestrator.ai;

import com.stockinsight.analysis.fundamental.FundamentalScore;
import com.stockinsight.analysis.indicator.TechnicalSnapshot;
import com.stockinsight.analysis.sentiment.SentimentAnalysis;
import com.stockinsight.common.model.FinancialIndicatorSet;
import com.stockinsight.common.model.ScoreResult;
import com.stockinsight.marketdata.symbol.ResolvedSymbol;

import java.util.Objects;

/**
 * Everything a narrative is written from. Category results are {@code null} when the
 * category is missing from {@code scores}; {@code name} is {@code null} when unknown.
 */
public record NarrativeInput(
    ResolvedSymbol symbol,
    String name,
    TechnicalSnapshot technical,
    FinancialIndicatorSet financials,
    FundamentalScore fundamental,
    SentimentAnalysis sentiment,
    ScoreResult scores
) {
    public NarrativeInput {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(scores, "scores");
    }

    /** {@code "Name (SYMBOL)"}, or just the symbol when the name is unknown. */
    public String displayName() {
        return name == null ? symbol.symbol() : name + " (" + symbol.symbol() + ")";
    }
}
