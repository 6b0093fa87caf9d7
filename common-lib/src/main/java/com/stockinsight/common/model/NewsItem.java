package com.stockinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

public record NewsItem(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("source") String source,
    @JsonProperty("title") String title,
    @JsonProperty("body") String body,
    @JsonProperty("category") NewsCategory category
) {
    public NewsItem {
        Objects.requireNonNull(id, "id");
        if (category == null) category = NewsCategory.COMPANY_NEWS;
        if (title == null) title = "";
        if (body == null) body = "";
    }

    public static NewsItem of(String id, Instant timestamp, String source,
                              String title, String body, NewsCategory category) {
        return new NewsItem(id, timestamp, source, title, body, category);
    }

    /** Title and body joined, the text the lexicon is matched against. */
    public String text() {
        return body.isEmpty() ? title : title + " " + body;
    }
}
