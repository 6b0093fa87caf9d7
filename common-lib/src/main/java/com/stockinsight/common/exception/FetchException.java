package com.stockinsight.common.exception;

import com.stockinsight.common.model.DataCategory;

/**
 * An upstream collaborator failed, timed out, or returned nothing usable for one data
 * category. Retrying is the caller's decision.
 */
public class FetchException extends AnalysisException {
    private final DataCategory category;
    private final String symbol;

    public FetchException(DataCategory category, String symbol, String message) {
        super("fetch:" + category.name().toLowerCase(), message + " symbol=" + symbol);
        this.category = category;
        this.symbol = symbol;
    }

    public FetchException(DataCategory category, String symbol, String message, Throwable cause) {
        super("fetch:" + category.name().toLowerCase(), message + " symbol=" + symbol, cause);
        this.category = category;
        this.symbol = symbol;
    }

    public DataCategory getCategory() {
        return category;
    }

    public String getSymbol() {
        return symbol;
    }
}
