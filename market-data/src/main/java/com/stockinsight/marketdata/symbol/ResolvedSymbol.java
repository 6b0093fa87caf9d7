package com.stockinsight.marketdata.symbol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsight.common.model.Market;

/** A normalised symbol and its market. */
public record ResolvedSymbol(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("market") Market market
) {
    /** Key shared by the cache and the task de-duplication: {@code HK:00700}. */
    public String cacheKey() {
        return market.name() + ":" + symbol;
    }
}
