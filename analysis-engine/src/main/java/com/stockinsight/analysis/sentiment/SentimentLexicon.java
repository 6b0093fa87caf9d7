package com.stockinsight.analysis.sentiment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockinsight.common.exception.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Weighted positive and negative term dictionaries, loaded once and never mutated.
 *
 * <p>Latin-script terms match at a word start and are case-insensitive ({@code "gain"}
 * matches "gains" but not "against"). Other terms, Chinese ones in particular, match
 * as plain substrings. A term counts once per text however often it occurs.
 *
 * <p>JSON layout:
 * <pre>
 * { "positive": { "利好": 1.2, "upgrade": 1.2 }, "negative": { "亏损": 1.2 } }
 * </pre>
 */
public final class SentimentLexicon {

    public static final String DEFAULT_RESOURCE = "sentiment-lexicon.json";

    private final Map<String, Double> positive;
    private final Map<String, Double> negative;
    private final List<Term> positiveTerms;
    private final List<Term> negativeTerms;

    private SentimentLexicon(Map<String, Double> positive, Map<String, Double> negative) {
        this.positive = Collections.unmodifiableMap(new LinkedHashMap<>(positive));
        this.negative = Collections.unmodifiableMap(new LinkedHashMap<>(negative));
        this.positiveTerms = compile(this.positive);
        this.negativeTerms = compile(this.negative);
    }

    public static SentimentLexicon of(Map<String, Double> positive, Map<String, Double> negative) {
        validate("positive", positive);
        validate("negative", negative);
        return new SentimentLexicon(positive, negative);
    }

    public static SentimentLexicon fromJson(InputStream in, ObjectMapper mapper) {
        try {
            Map<String, Map<String, Double>> raw = mapper.readValue(in, new TypeReference<>() {});
            if (raw == null) throw new ConfigurationException("Sentiment lexicon is empty");
            return of(raw.getOrDefault("positive", Map.of()), raw.getOrDefault("negative", Map.of()));
        } catch (IOException e) {
            throw new ConfigurationException("Unreadable sentiment lexicon: " + e.getMessage(), e);
        }
    }

    /** Loads {@value #DEFAULT_RESOURCE} from the classpath. */
    public static SentimentLexicon loadDefault(ObjectMapper mapper) {
        try (InputStream in = SentimentLexicon.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new ConfigurationException("Missing classpath resource " + DEFAULT_RESOURCE);
            return fromJson(in, mapper);
        } catch (IOException e) {
            throw new ConfigurationException("Unreadable sentiment lexicon: " + e.getMessage(), e);
        }
    }

    public Map<String, Double> positive() { return positive; }

    public Map<String, Double> negative() { return negative; }

    /**
     * Sums the weights of the positive and negative terms found in {@code text}.
     */
    public Match match(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return new Match(sum(positiveTerms, lower), sum(negativeTerms, lower));
    }

    public record Match(double positiveWeight, double negativeWeight) {
        public boolean isEmpty() {
            return positiveWeight == 0 && negativeWeight == 0;
        }
    }

    private record Term(String text, Pattern wordStart, double weight) {
        boolean foundIn(String lower) {
            return wordStart != null ? wordStart.matcher(lower).find() : lower.contains(text);
        }
    }

    private static double sum(List<Term> terms, String lower) {
        double total = 0;
        for (Term term : terms) {
            if (term.foundIn(lower)) total += term.weight();
        }
        return total;
    }

    private static List<Term> compile(Map<String, Double> terms) {
        List<Term> out = new ArrayList<>(terms.size());
        terms.forEach((text, weight) -> {
            String lower = text.toLowerCase(Locale.ROOT);
            Pattern p = lower.matches("[a-z][a-z '\\-]*") ? Pattern.compile("\\b" + Pattern.quote(lower)) : null;
            out.add(new Term(lower, p, weight));
        });
        return List.copyOf(out);
    }

    private static void validate(String polarity, Map<String, Double> terms) {
        if (terms == null) throw new ConfigurationException("Missing " + polarity + " sentiment terms");
        terms.forEach((term, weight) -> {
            if (term == null || term.isBlank()) {
                throw new ConfigurationException("Blank " + polarity + " sentiment term");
            }
            if (weight == null || !Double.isFinite(weight) || weight <= 0) {
                throw new ConfigurationException("Sentiment term '" + term + "' needs a positive weight");
            }
        });
    }
}
