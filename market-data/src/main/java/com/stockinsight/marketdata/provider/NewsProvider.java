package com.stockinsight.marketdata.provider;

import com.stockinsight.common.model.Market;
import com.stockinsight.common.model.NewsItem;
import reactor.core.publisher.Mono;

import java.util.List;

/** Company news, announcements and research reports, newest first. */
public interface NewsProvider {
    Mono<List<NewsItem>> fetchNews(String symbol, Market market, int maxCount);
}
