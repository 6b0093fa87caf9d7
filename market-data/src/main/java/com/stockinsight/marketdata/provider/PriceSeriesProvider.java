package com.stockinsight.marketdata.provider;

import com.stockinsight.common.model.Market;
import com.stockinsight.common.model.PriceSeries;
import reactor.core.publisher.Mono;

/**
 * Upstream source of daily price bars. Implementations signal failure with an error
 * and never block the calling thread.
 */
public interface PriceSeriesProvider {
    Mono<PriceSeries> fetchPriceSeries(String symbol, Market market, int periodDays);
}
