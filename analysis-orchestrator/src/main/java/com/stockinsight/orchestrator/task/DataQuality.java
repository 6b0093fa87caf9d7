package com.stockinsight.orchestrator.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsight.common.model.DataCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * How complete the data behind a report was. {@code problems} explains each missing
 * or degraded category in words.
 */
public record DataQuality(
    @JsonProperty("indicatorsUsed") int indicatorsUsed,
    @JsonProperty("indicatorsTotal") int indicatorsTotal,
    @JsonProperty("newsAnalyzed") int newsAnalyzed,
    @JsonProperty("completeness") Completeness completeness,
    @JsonProperty("missingCategories") Set<DataCategory> missingCategories,
    @JsonProperty("problems") Map<DataCategory, String> problems
) {
    /** Fewer financial indicators than this makes a report partial. */
    public static final int MIN_INDICATORS_FOR_COMPLETE = 15;

    public enum Completeness { COMPLETE, PARTIAL }

    public DataQuality {
        missingCategories = missingCategories == null || missingCategories.isEmpty()
            ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(missingCategories));
        problems = problems == null || problems.isEmpty()
            ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(problems));
    }

    public static DataQuality of(int indicatorsUsed, int indicatorsTotal, int newsAnalyzed,
                                 Set<DataCategory> missing, Map<DataCategory, String> problems) {
        Completeness completeness = missing.isEmpty() && problems.isEmpty()
            && indicatorsUsed >= MIN_INDICATORS_FOR_COMPLETE
            ? Completeness.COMPLETE : Completeness.PARTIAL;
        return new DataQuality(indicatorsUsed, indicatorsTotal, newsAnalyzed, completeness, missing, problems);
    }
}
