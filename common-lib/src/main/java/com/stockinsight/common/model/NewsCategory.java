package com.stockinsight.common.model;

/**
 * Kind of news item. The weight scales the item's polarity in the overall sentiment:
 * company announcements count more than general news, analyst reports slightly less.
 */
public enum NewsCategory {
    COMPANY_NEWS(1.0),
    ANNOUNCEMENT(1.2),
    RESEARCH_REPORT(0.9);

    private final double weight;

    NewsCategory(double weight) {
        this.weight = weight;
    }

    public double weight() { return weight; }
}
