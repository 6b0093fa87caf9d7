package com.stockinsight.common.model;

/**
 * The three upstream data categories an analysis draws on. Each category has its own
 * cache TTL, its own collaborator and its own sub-score.
 */
public enum DataCategory {
    PRICE,
    FUNDAMENTAL,
    NEWS
}
