package com.stockinsight.analysis.fundamental;

import com.stockinsight.common.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Piecewise-linear mapping from an indicator value to a 0–100 partial score.
 *
 * <p>Control points are strictly ascending in x. Between points the score is
 * interpolated linearly; outside the first and last point it is held flat.
 * A curve whose scores fall as x grows expresses "lower is better" (debt ratio).
 */
public final class ScoringCurve {

    private final double[] xs;
    private final double[] scores;

    private ScoringCurve(double[] xs, double[] scores) {
        this.xs = xs;
        this.scores = scores;
    }

    /**
     * @param points alternating x, score pairs: {@code of(0, 20, 10, 60, 20, 100)}
     */
    public static ScoringCurve of(double... points) {
        if (points.length == 0 || points.length % 2 != 0) {
            throw new ConfigurationException("Scoring curve needs x:score pairs, got " + points.length + " numbers");
        }
        int n = points.length / 2;
        double[] xs = new double[n];
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = points[2 * i];
            scores[i] = points[2 * i + 1];
            if (!Double.isFinite(xs[i]) || !Double.isFinite(scores[i])) {
                throw new ConfigurationException("Scoring curve points must be finite");
            }
            if (scores[i] < 0 || scores[i] > 100) {
                throw new ConfigurationException("Scoring curve score outside [0, 100]: " + scores[i]);
            }
            if (i > 0 && xs[i] <= xs[i - 1]) {
                throw new ConfigurationException("Scoring curve x values must be strictly ascending near x=" + xs[i]);
            }
        }
        return new ScoringCurve(xs, scores);
    }

    /**
     * Parses {@code "0:20, 10:60, 20:100"}.
     */
    public static ScoringCurve parse(String definition) {
        if (definition == null || definition.isBlank()) throw new ConfigurationException("Empty scoring curve");
        List<Double> values = new ArrayList<>();
        for (String pair : definition.split(",")) {
            String[] parts = pair.trim().split(":");
            if (parts.length != 2) throw new ConfigurationException("Malformed scoring curve point '" + pair.trim() + "'");
            try {
                values.add(Double.parseDouble(parts[0].trim()));
                values.add(Double.parseDouble(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Malformed scoring curve point '" + pair.trim() + "'", e);
            }
        }
        return of(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public double score(double value) {
        if (value <= xs[0]) return scores[0];
        int last = xs.length - 1;
        if (value >= xs[last]) return scores[last];
        int i = 1;
        while (xs[i] < value) i++;
        double t = (value - xs[i - 1]) / (xs[i] - xs[i - 1]);
        return scores[i - 1] + t * (scores[i] - scores[i - 1]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoringCurve other)) return false;
        return Arrays.equals(xs, other.xs) && Arrays.equals(scores, other.scores);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(xs) + Arrays.hashCode(scores);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < xs.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format(Locale.ROOT, "%s:%s", xs[i], scores[i]));
        }
        return sb.toString();
    }
}
