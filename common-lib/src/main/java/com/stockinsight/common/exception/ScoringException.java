package com.stockinsight.common.exception;

import com.stockinsight.common.model.DataCategory;

/**
 * Input for one category was malformed or insufficient to score. The category is
 * reported as missing and the composite is computed from the remaining ones.
 */
public class ScoringException extends AnalysisException {
    private final DataCategory category;

    public ScoringException(DataCategory category, String message) {
        super("scoring:" + category.name().toLowerCase(), message);
        this.category = category;
    }

    public DataCategory getCategory() {
        return category;
    }
}
