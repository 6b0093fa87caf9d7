package com.stockinsight.orchestrator.ai;

import com.stockinsight.analysis.indicator.TechnicalSnapshot;
import com.stockinsight.analysis.sentiment.SentimentAnalysis;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.ScoreResult;

import java.util.Locale;

/**
 * Deterministic Markdown narrative assembled from the scores alone. Used whenever no AI
 * provider delivers one.
 */
public class RuleBasedNarrativeGenerator {

    public String generate(NarrativeInput input) {
        ScoreResult scores = input.scores();
        StringBuilder sb = new StringBuilder(1024);

        sb.append("## Overall assessment\n\n")
          .append(marketProfile(input)).append("\n\n")
          .append(String.format(Locale.ROOT, "%s scores %.1f overall, which maps to **%s**.%n%n",
              input.displayName(), scores.composite(), scores.recommendation().label()));
        for (DataCategory category : DataCategory.values()) {
            Double sub = scores.subScore(category);
            sb.append("- ").append(PromptBuilder.label(category)).append(": ")
              .append(sub == null ? "unavailable" : String.format(Locale.ROOT, "%.1f/100", sub)).append('\n');
        }
        if (scores.isPartial()) {
            sb.append("\nThis is a partial result; missing data: ").append(scores.missingCategories()).append(".\n");
        }

        TechnicalSnapshot t = input.technical();
        if (t != null) {
            sb.append("\n## Technical picture\n\n")
              .append("- Moving-average trend: ").append(t.maTrend() == null ? "n/a" : t.maTrend()).append('\n')
              .append("- RSI: ").append(t.rsi() == null ? "n/a"
                  : String.format(Locale.ROOT, "%.1f (%s)", t.rsi().value(), t.rsi().zone())).append('\n')
              .append("- MACD: ").append(t.macd() == null ? "n/a" : t.macd().cross()).append('\n')
              .append("- Volume: ").append(t.volume() == null ? "n/a" : t.volume().signal()).append('\n')
              .append("\nTechnical assessment: ").append(band(t.score(), "strong", "neutral", "weak")).append(".\n");
        }

        if (input.fundamental() != null) {
            sb.append("\n## Financial health\n\n")
              .append(String.format(Locale.ROOT, "%d of %d indicators available. Assessment: %s.%n",
                  input.fundamental().indicatorsUsed(), input.fundamental().indicatorsTotal(),
                  band(input.fundamental().score(), "excellent", "sound", "needs attention")));
        }

        SentimentAnalysis s = input.sentiment();
        if (s != null && s.noData()) {
            sb.append("\n## News sentiment\n\nNo analysable news was found; sentiment is treated as neutral.\n");
        } else if (s != null) {
            sb.append("\n## News sentiment\n\n")
              .append(String.format(Locale.ROOT,
                  "%d news items analysed, overall %.2f (%s), %s, confidence %.2f.%n",
                  s.itemsAnalyzed(), s.overall(), s.trend(), s.direction(), s.confidence()));
        }

        sb.append("\n## Recommendation\n\n").append(advice(scores)).append('\n')
          .append("\n_Generated from rule-based scoring; no AI narrative was available._\n");
        return sb.toString();
    }

    private static String marketProfile(NarrativeInput input) {
        return switch (input.symbol().market()) {
            case A_SHARE -> "Mainland China A-share listing, priced in CNY, T+1 settlement with daily price limits.";
            case HK      -> "Hong Kong listing, priced in HKD, T+0 trading without daily price limits.";
            case US      -> "US listing, priced in USD, T+0 trading with pre- and after-market sessions.";
        };
    }

    private static String advice(ScoreResult scores) {
        return switch (scores.recommendation()) {
            case STRONG_BUY  -> "Fundamentals, technicals and sentiment align positively; the setup supports accumulation.";
            case BUY         -> "The balance of evidence is positive; consider building a position with risk limits.";
            case HOLD        -> "Signals are mixed; hold existing positions and wait for confirmation.";
            case SELL        -> "The balance of evidence is negative; consider reducing exposure.";
            case STRONG_SELL -> "Multiple dimensions are weak; avoid new exposure and review existing positions.";
        };
    }

    private static String band(double score, String high, String mid, String low) {
        if (score >= 70) return high;
        if (score >= 50) return mid;
        return low;
    }
}
