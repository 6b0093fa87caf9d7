package com.stockinsight.orchestrator.ai;

import com.stockinsight.analysis.indicator.PriceSummary;
import com.stockinsight.analysis.indicator.TechnicalSnapshot;
import com.stockinsight.analysis.sentiment.SentimentAnalysis;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.FinancialIndicator;
import com.stockinsight.common.model.ScoreResult;

import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link NarrativeInput} into the user prompt sent to every provider.
 * Sections for missing categories say so explicitly instead of inventing values.
 */
public class PromptBuilder {

    private static final int MAX_LISTED_INDICATORS = 25;

    public String build(NarrativeInput input) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("Analyse the security below and write an investment report.\n\n");

        sb.append("## Security\n");
        sb.append("Symbol: ").append(input.symbol().symbol()).append('\n');
        if (input.name() != null) sb.append("Name: ").append(input.name()).append('\n');
        sb.append("Market: ").append(input.symbol().market())
          .append(" (currency ").append(input.symbol().market().currency()).append(")\n\n");

        appendTechnical(sb, input.technical());
        appendFundamentals(sb, input);
        appendSentiment(sb, input.sentiment());
        appendScores(sb, input.scores());

        sb.append("""
            ## Instructions
            Cover, in this order: overall assessment, technical picture, financial health,
            news sentiment, key risks, and a concluding recommendation consistent with the
            scores above. Treat any section marked unavailable as missing data and say so.
            """);
        return sb.toString();
    }

    private void appendTechnical(StringBuilder sb, TechnicalSnapshot t) {
        sb.append("## Technical analysis\n");
        if (t == null) {
            sb.append("Unavailable: price data could not be retrieved or scored.\n\n");
            return;
        }
        PriceSummary p = t.priceSummary();
        if (p != null) {
            sb.append("Current price: ").append(fmt(p.currentPrice())).append('\n');
            if (p.changePercent() != null) sb.append("Change: ").append(fmt(p.changePercent())).append("%\n");
            if (p.volumeRatio() != null) sb.append("Volume ratio: ").append(fmt(p.volumeRatio())).append('\n');
            if (p.volatilityPercent() != null) {
                sb.append("Daily return volatility: ").append(fmt(p.volatilityPercent())).append("%\n");
            }
        }
        sb.append("Bars analysed: ").append(t.barsUsed()).append('\n');
        if (t.maTrend() != null) sb.append("Moving-average trend: ").append(t.maTrend()).append('\n');
        t.movingAverages().forEach((window, value) ->
            sb.append("MA").append(window).append(": ").append(fmt(value)).append('\n'));
        if (t.rsi() != null) {
            sb.append("RSI: ").append(fmt(t.rsi().value())).append(" (").append(t.rsi().zone()).append(")\n");
        }
        if (t.macd() != null) {
            sb.append("MACD: ").append(fmt(t.macd().macd()))
              .append(" signal ").append(fmt(t.macd().signal()))
              .append(" histogram ").append(fmt(t.macd().histogram()))
              .append(" cross ").append(t.macd().cross()).append('\n');
        }
        if (t.bollinger() != null) {
            sb.append("Bollinger: upper ").append(fmt(t.bollinger().upper()))
              .append(" middle ").append(fmt(t.bollinger().middle()))
              .append(" lower ").append(fmt(t.bollinger().lower()))
              .append(" position ").append(fmt(t.bollinger().position())).append('\n');
        }
        if (t.volume() != null) {
            sb.append("Volume: ratio ").append(fmt(t.volume().ratio()))
              .append(" ").append(t.volume().signal()).append('\n');
        }
        if (!t.omitted().isEmpty()) sb.append("Not computable: ").append(t.omitted()).append('\n');
        sb.append('\n');
    }

    private void appendFundamentals(StringBuilder sb, NarrativeInput input) {
        sb.append("## Fundamentals\n");
        if (input.fundamental() == null || input.financials() == null) {
            sb.append("Unavailable: financial indicators could not be retrieved or scored.\n\n");
            return;
        }
        sb.append("Indicators available: ").append(input.fundamental().indicatorsUsed())
          .append('/').append(input.fundamental().indicatorsTotal()).append('\n');
        int listed = 0;
        for (Map.Entry<FinancialIndicator, Double> e : input.financials().values().entrySet()) {
            if (listed++ >= MAX_LISTED_INDICATORS) break;
            sb.append("- ").append(e.getKey()).append(": ").append(fmt(e.getValue())).append('\n');
        }
        input.fundamental().groupScores().forEach((group, score) ->
            sb.append("Group ").append(group).append(" score: ").append(fmt(score)).append('\n'));
        sb.append('\n');
    }

    private void appendSentiment(StringBuilder sb, SentimentAnalysis s) {
        sb.append("## News sentiment\n");
        if (s == null) {
            sb.append("Unavailable: news could not be retrieved.\n\n");
            return;
        }
        if (s.noData()) {
            sb.append("No analysable news among ").append(s.itemsReceived())
              .append(" items received; sentiment set to neutral with zero confidence.\n\n");
            return;
        }
        sb.append("Items analysed: ").append(s.itemsAnalyzed()).append('\n');
        sb.append("Overall: ").append(fmt(s.overall())).append(" (").append(s.trend()).append(")\n");
        sb.append("Direction: ").append(s.direction()).append('\n');
        sb.append("Confidence: ").append(fmt(s.confidence())).append('\n');
        sb.append("Positive ratio: ").append(fmt(s.positiveRatio()))
          .append(", negative ratio: ").append(fmt(s.negativeRatio())).append("\n\n");
    }

    private void appendScores(StringBuilder sb, ScoreResult scores) {
        sb.append("## Scores (0-100)\n");
        for (DataCategory category : DataCategory.values()) {
            Double sub = scores.subScore(category);
            sb.append(label(category)).append(": ").append(sub == null ? "unavailable" : fmt(sub)).append('\n');
        }
        sb.append("Composite: ").append(fmt(scores.composite())).append('\n');
        sb.append("Recommendation: ").append(scores.recommendation().label()).append('\n');
        if (scores.isPartial()) sb.append("Note: partial result, missing ").append(scores.missingCategories()).append('\n');
        sb.append('\n');
    }

    static String label(DataCategory category) {
        return switch (category) {
            case PRICE       -> "Technical";
            case FUNDAMENTAL -> "Fundamental";
            case NEWS        -> "Sentiment";
        };
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
