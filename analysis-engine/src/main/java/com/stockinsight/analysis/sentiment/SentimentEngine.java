package com.stockinsight.analysis.sentiment;

import com.stockinsight.common.model.NewsCategory;
import com.stockinsight.common.model.NewsItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lexicon-based sentiment over a newest-first news sequence.
 *
 * <p>Item score = {@code (pos − neg) / (pos + neg) × categoryWeight}, clamped to [-1, 1],
 * where pos and neg are the summed weights of the matched lexicon terms. Items without
 * text are skipped. Confidence is {@code (1 − σ) / (1 + σ)} over the item scores, so
 * unanimous coverage gives 1 and maximal disagreement gives 0.
 */
public class SentimentEngine {

    private static final Logger log = LoggerFactory.getLogger(SentimentEngine.class);
    private static final double DIRECTION_THRESHOLD = 0.1;

    private final SentimentLexicon lexicon;
    private final SentimentSettings settings;

    public SentimentEngine(SentimentLexicon lexicon, SentimentSettings settings) {
        this.lexicon = lexicon;
        this.settings = settings;
    }

    public SentimentSettings settings() {
        return settings;
    }

    public SentimentAnalysis analyze(List<NewsItem> news) {
        int received = news == null ? 0 : news.size();
        List<NewsItem> items = prepare(news);

        List<Double> scores = new ArrayList<>(items.size());
        Map<NewsCategory, double[]> byCategory = new EnumMap<>(NewsCategory.class);
        for (NewsItem item : items) {
            String text = truncate(item.text());
            if (text.isBlank()) continue;
            double s = scoreItem(text, item.category());
            scores.add(s);
            double[] acc = byCategory.computeIfAbsent(item.category(), c -> new double[2]);
            acc[0] += s;
            acc[1]++;
        }

        if (scores.isEmpty()) {
            log.debug("[SentimentEngine] no analysable news received={}", received);
            return SentimentAnalysis.noData(received);
        }

        double mean = mean(scores);
        double sigma = stdDev(scores, mean);
        double confidence = (1.0 - Math.min(sigma, 1.0)) / (1.0 + sigma);
        long positives = scores.stream().filter(s -> s > 0).count();
        long negatives = scores.stream().filter(s -> s < 0).count();

        Map<NewsCategory, Double> categoryMeans = new EnumMap<>(NewsCategory.class);
        byCategory.forEach((c, acc) -> categoryMeans.put(c, acc[0] / acc[1]));

        double score = (mean + 1.0) * 50.0;
        log.debug("[SentimentEngine] analysed={} received={} overall={} confidence={}",
            scores.size(), received, String.format("%.3f", mean), String.format("%.3f", confidence));

        return new SentimentAnalysis(score, mean, SentimentTrend.of(mean), direction(scores), confidence,
            scores.size(), received,
            (double) positives / scores.size(), (double) negatives / scores.size(),
            categoryMeans, false);
    }

    double scoreItem(String text, NewsCategory category) {
        SentimentLexicon.Match m = lexicon.match(text);
        if (m.isEmpty()) return 0.0;
        double polarity = (m.positiveWeight() - m.negativeWeight()) / (m.positiveWeight() + m.negativeWeight());
        return Math.max(-1.0, Math.min(1.0, polarity * category.weight()));
    }

    /** Drops duplicate ids (first occurrence wins) and keeps the newest {@code maxItems}. */
    private List<NewsItem> prepare(List<NewsItem> news) {
        if (news == null || news.isEmpty()) return List.of();
        Set<String> seen = new HashSet<>();
        List<NewsItem> out = new ArrayList<>();
        for (NewsItem item : news) {
            if (item == null || !seen.add(item.id())) continue;
            out.add(item);
            if (out.size() == settings.maxItems()) break;
        }
        return out;
    }

    private String truncate(String text) {
        return text.length() <= settings.maxContentLength() ? text : text.substring(0, settings.maxContentLength());
    }

    /** Scores are newest-first; the newer half is the front of the list. */
    private static SentimentDirection direction(List<Double> scores) {
        if (scores.size() < 2) return SentimentDirection.STABLE;
        int half = scores.size() / 2;
        double newer = mean(scores.subList(0, half));
        double older = mean(scores.subList(scores.size() - half, scores.size()));
        double delta = newer - older;
        if (delta > DIRECTION_THRESHOLD) return SentimentDirection.IMPROVING;
        if (delta < -DIRECTION_THRESHOLD) return SentimentDirection.DETERIORATING;
        return SentimentDirection.STABLE;
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    private static double stdDev(List<Double> values, double mean) {
        double variance = 0;
        for (double v : values) variance += (v - mean) * (v - mean);
        return Math.sqrt(variance / values.size());
    }
}
