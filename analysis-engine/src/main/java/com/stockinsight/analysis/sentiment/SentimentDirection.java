package com.stockinsight.analysis.sentiment;

/** Newer half of the items compared with the older half. */
public enum SentimentDirection {
    IMPROVING,
    STABLE,
    DETERIORATING
}
