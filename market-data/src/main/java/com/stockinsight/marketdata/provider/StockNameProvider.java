package com.stockinsight.marketdata.provider;

import com.stockinsight.common.model.Market;
import reactor.core.publisher.Mono;

/** Display name of a security. Completes empty when the upstream has none. */
public interface StockNameProvider {
    Mono<String> fetchStockName(String symbol, Market market);
}
