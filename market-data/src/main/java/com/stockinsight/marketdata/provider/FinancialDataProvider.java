package com.stockinsight.marketdata.provider;

import com.stockinsight.common.model.FinancialIndicatorSet;
import com.stockinsight.common.model.Market;
import reactor.core.publisher.Mono;

public interface FinancialDataProvider {
    Mono<FinancialIndicatorSet> fetchFinancialIndicators(String symbol, Market market);
}
