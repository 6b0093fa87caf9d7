package com.stockinsight.analysis.indicator;

import com.stockinsight.common.exception.ScoringException;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link PriceSeries} into a {@link TechnicalSnapshot}.
 *
 * <p>Each indicator yields a signal in [-1, 1] (bearish to bullish). The technical score is
 * {@code 50 + 50 × Σ wᵢ·sᵢ / Σ wᵢ} over the indicators that could be computed, so it is
 * deterministic, bounded to [0, 100] and monotonic in every signal.
 *
 * <p>Stateless and thread-safe.
 */
public class IndicatorEngine {

    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    private final IndicatorSettings settings;

    public IndicatorEngine(IndicatorSettings settings) {
        this.settings = settings;
    }

    public IndicatorSettings settings() {
        return settings;
    }

    /**
     * @throws ScoringException if the series is empty or too short for any indicator
     */
    public TechnicalSnapshot analyze(PriceSeries series) {
        if (series == null || series.isEmpty()) {
            throw new ScoringException(DataCategory.PRICE, "Empty price series");
        }
        List<Double> closes = series.closes();
        List<Long> volumes = series.volumes();
        double price = closes.get(closes.size() - 1);

        Map<TechnicalIndicator, Double> signals = new EnumMap<>(TechnicalIndicator.class);

        Map<Integer, Double> mas = movingAverages(closes);
        MaTrend trend = classifyTrend(price, mas);
        if (!mas.isEmpty()) signals.put(TechnicalIndicator.MOVING_AVERAGE, maSignal(trend, price, mas));

        RsiReading rsi = null;
        double rsiValue = TechnicalIndicators.rsi(closes, settings.rsiWindow());
        if (!Double.isNaN(rsiValue)) {
            rsi = RsiReading.of(rsiValue);
            signals.put(TechnicalIndicator.RSI, rsiSignal(rsi));
        }

        MacdReading macd = macd(closes);
        if (macd != null) signals.put(TechnicalIndicator.MACD, macdSignal(macd));

        BollingerReading bollinger = bollinger(closes, price);
        if (bollinger != null) signals.put(TechnicalIndicator.BOLLINGER, bollingerSignal(bollinger));

        VolumeReading volume = volume(closes, volumes);
        if (volume != null) {
            signals.put(TechnicalIndicator.VOLUME,
                volume.signal() == VolumeSignal.CONFIRMING ? Math.signum(lastChange(closes)) : 0.0);
        }

        if (signals.isEmpty()) {
            throw new ScoringException(DataCategory.PRICE,
                "Price series too short for any indicator. symbol=" + series.symbol() + " bars=" + series.size());
        }

        Set<TechnicalIndicator> omitted = EnumSet.allOf(TechnicalIndicator.class);
        omitted.removeAll(signals.keySet());

        double score = aggregate(signals);
        PriceSummary summary = priceSummary(closes, price, volume);

        log.debug("[IndicatorEngine] symbol={} bars={} trend={} score={} omitted={}",
            series.symbol(), series.size(), trend, String.format("%.2f", score), omitted);

        return new TechnicalSnapshot(series.symbol(), series.size(), mas, trend, rsi, macd,
            bollinger, volume, summary, omitted, score);
    }

    // ── Moving averages ─────────────────────────────────────────────────────

    private Map<Integer, Double> movingAverages(List<Double> closes) {
        Map<Integer, Double> mas = new LinkedHashMap<>();
        for (int window : settings.maWindows()) {
            double ma = TechnicalIndicators.sma(closes, window);
            if (!Double.isNaN(ma)) mas.put(window, ma);
        }
        return mas;
    }

    /** price > MA(shortest) > … > MA(longest) is bullish, the mirror chain bearish. */
    static MaTrend classifyTrend(double price, Map<Integer, Double> mas) {
        if (mas.isEmpty()) return MaTrend.MIXED;
        boolean bullish = true;
        boolean bearish = true;
        double previous = price;
        for (double ma : mas.values()) {
            if (!(previous > ma)) bullish = false;
            if (!(previous < ma)) bearish = false;
            previous = ma;
        }
        if (bullish) return MaTrend.BULLISH;
        if (bearish) return MaTrend.BEARISH;
        return MaTrend.MIXED;
    }

    private static double maSignal(MaTrend trend, double price, Map<Integer, Double> mas) {
        if (trend == MaTrend.BULLISH) return 1.0;
        if (trend == MaTrend.BEARISH) return -1.0;
        int above = 0;
        int below = 0;
        for (double ma : mas.values()) {
            if (price > ma) above++;
            else if (price < ma) below++;
        }
        return 0.5 * (above - below) / mas.size();
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    private static double rsiSignal(RsiReading rsi) {
        return switch (rsi.zone()) {
            case OVERBOUGHT -> -0.5;
            case OVERSOLD   -> 0.5;
            case NEUTRAL    -> (rsi.value() - 50.0) / 40.0;
        };
    }

    // ── MACD ────────────────────────────────────────────────────────────────

    private MacdReading macd(List<Double> closes) {
        int fast = settings.macdFast();
        int slow = settings.macdSlow();
        int signalSpan = settings.macdSignal();
        if (closes.size() < slow + signalSpan) return null;

        double[] values = TechnicalIndicators.toArray(closes);
        double[] emaFast = TechnicalIndicators.emaSeries(values, fast);
        double[] emaSlow = TechnicalIndicators.emaSeries(values, slow);

        // MACD line is defined from the first bar where the slow EMA exists
        int offset = slow - 1;
        double[] line = new double[values.length - offset];
        for (int i = offset; i < values.length; i++) line[i - offset] = emaFast[i] - emaSlow[i];
        double[] signal = TechnicalIndicators.emaSeries(line, signalSpan);

        int last = line.length - 1;
        double macd = line[last];
        double sig = signal[last];
        MacdCross cross = MacdCross.NONE;
        if (!Double.isNaN(signal[last - 1])) {
            double prevDiff = line[last - 1] - signal[last - 1];
            double diff = macd - sig;
            if (prevDiff <= 0 && diff > 0) cross = MacdCross.BULLISH_CROSS;
            else if (prevDiff >= 0 && diff < 0) cross = MacdCross.BEARISH_CROSS;
        }
        return new MacdReading(macd, sig, macd - sig, cross);
    }

    private static double macdSignal(MacdReading macd) {
        return switch (macd.cross()) {
            case BULLISH_CROSS -> 1.0;
            case BEARISH_CROSS -> -1.0;
            case NONE          -> 0.5 * Math.signum(macd.histogram());
        };
    }

    // ── Bollinger bands ─────────────────────────────────────────────────────

    private BollingerReading bollinger(List<Double> closes, double price) {
        int window = settings.bollingerWindow();
        double middle = TechnicalIndicators.sma(closes, window);
        if (Double.isNaN(middle)) return null;
        double sd = TechnicalIndicators.stdDev(closes, window);
        double upper = middle + settings.bollingerK() * sd;
        double lower = middle - settings.bollingerK() * sd;
        double position = upper > lower ? (price - lower) / (upper - lower) : 0.5;
        return new BollingerReading(upper, middle, lower,
            Math.max(0.0, Math.min(1.0, position)), price > upper, price < lower);
    }

    /** Near the lower band reads as oversold (bullish), near the upper band as stretched. */
    private static double bollingerSignal(BollingerReading bb) {
        if (bb.belowLower()) return 1.0;
        if (bb.aboveUpper()) return -1.0;
        return 1.0 - 2.0 * bb.position();
    }

    // ── Volume ──────────────────────────────────────────────────────────────

    private VolumeReading volume(List<Double> closes, List<Long> volumes) {
        int window = settings.volumeWindow();
        int n = volumes.size();
        if (n < window + 1) return null;
        double sum = 0;
        for (int i = n - 1 - window; i < n - 1; i++) sum += volumes.get(i);
        double avg = sum / window;
        if (avg <= 0) return null;
        double ratio = volumes.get(n - 1) / avg;

        double move = Math.signum(lastChange(closes));
        double trendRef = TechnicalIndicators.sma(closes, window);
        double trend = Math.signum(closes.get(closes.size() - 1) - trendRef);
        boolean confirming = ratio > 1.0 && move != 0 && move == trend;
        return new VolumeReading(ratio, confirming ? VolumeSignal.CONFIRMING : VolumeSignal.DIVERGENT);
    }

    private static double lastChange(List<Double> closes) {
        int n = closes.size();
        return n < 2 ? 0.0 : closes.get(n - 1) - closes.get(n - 2);
    }

    // ── Aggregation ─────────────────────────────────────────────────────────

    private double aggregate(Map<TechnicalIndicator, Double> signals) {
        double weighted = 0;
        double total = 0;
        for (Map.Entry<TechnicalIndicator, Double> e : signals.entrySet()) {
            double w = settings.weights().weightOf(e.getKey());
            weighted += w * e.getValue();
            total += w;
        }
        if (total <= 0) return 50.0;
        double score = 50.0 + 50.0 * (weighted / total);
        return Math.max(0.0, Math.min(100.0, score));
    }

    private static PriceSummary priceSummary(List<Double> closes, double price, VolumeReading volume) {
        Double change = null;
        if (closes.size() >= 2) {
            double prev = closes.get(closes.size() - 2);
            if (prev != 0) change = (price - prev) / prev * 100.0;
        }
        double vol = TechnicalIndicators.returnVolatilityPercent(closes);
        return new PriceSummary(price, change,
            volume == null ? null : volume.ratio(),
            Double.isNaN(vol) ? null : vol);
    }
}
