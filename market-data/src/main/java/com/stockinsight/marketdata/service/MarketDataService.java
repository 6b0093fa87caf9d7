package com.stockinsight.marketdata.service;

import com.stockinsight.common.exception.FetchException;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.FinancialIndicatorSet;
import com.stockinsight.common.model.NewsItem;
import com.stockinsight.common.model.PriceSeries;
import com.stockinsight.marketdata.cache.TtlCache;
import com.stockinsight.marketdata.provider.FinancialDataProvider;
import com.stockinsight.marketdata.provider.NewsProvider;
import com.stockinsight.marketdata.provider.PriceSeriesProvider;
import com.stockinsight.marketdata.provider.StockNameProvider;
import com.stockinsight.marketdata.symbol.ResolvedSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Cache-fronted access to the three upstream collaborators.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Check {@link TtlCache} for a valid entry; on hit return it without an upstream call.</li>
 *   <li>On miss join the in-flight refresh for the same (category, key), or start one.</li>
 *   <li>The refresh is bounded by the fetch timeout, stores its result in the cache and
 *       leaves the in-flight table when it terminates.</li>
 * </ol>
 *
 * <p>The shared refresh is a {@code Mono.cache()}: a subscriber that cancels (a client
 * disconnecting) leaves the fetch running for the other subscribers and the cache.
 * Every failure surfaces as {@link FetchException} carrying the category.
 *
 * <p>Stock names are looked up separately and never fail: a lookup that errors or times
 * out completes empty. Found names are kept for the life of the service.
 */
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private record FlightKey(DataCategory category, String key) {}

    private final PriceSeriesProvider priceProvider;
    private final FinancialDataProvider financialProvider;
    private final NewsProvider newsProvider;
    private final StockNameProvider nameProvider;
    private final TtlCache cache;
    private final Duration fetchTimeout;
    private final int periodDays;
    private final int maxNews;

    private final ConcurrentHashMap<FlightKey, Mono<?>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> names = new ConcurrentHashMap<>();

    public MarketDataService(PriceSeriesProvider priceProvider,
                             FinancialDataProvider financialProvider,
                             NewsProvider newsProvider,
                             StockNameProvider nameProvider,
                             TtlCache cache,
                             Duration fetchTimeout,
                             int periodDays,
                             int maxNews) {
        this.priceProvider     = priceProvider;
        this.financialProvider = financialProvider;
        this.newsProvider      = newsProvider;
        this.nameProvider      = nameProvider;
        this.cache             = cache;
        this.fetchTimeout      = fetchTimeout;
        this.periodDays        = periodDays;
        this.maxNews           = maxNews;
    }

    public Mono<PriceSeries> getPriceSeries(ResolvedSymbol symbol) {
        return cached(DataCategory.PRICE, symbol,
            () -> priceProvider.fetchPriceSeries(symbol.symbol(), symbol.market(), periodDays));
    }

    public Mono<FinancialIndicatorSet> getFinancialIndicators(ResolvedSymbol symbol) {
        return cached(DataCategory.FUNDAMENTAL, symbol,
            () -> financialProvider.fetchFinancialIndicators(symbol.symbol(), symbol.market()));
    }

    public Mono<List<NewsItem>> getNews(ResolvedSymbol symbol) {
        return cached(DataCategory.NEWS, symbol,
            () -> newsProvider.fetchNews(symbol.symbol(), symbol.market(), maxNews));
    }

    public Mono<String> getStockName(ResolvedSymbol symbol) {
        String key = symbol.cacheKey();
        return Mono.defer(() -> {
            String known = names.get(key);
            if (known != null) return Mono.just(known);
            return nameProvider.fetchStockName(symbol.symbol(), symbol.market())
                .timeout(fetchTimeout)
                .filter(name -> !name.isBlank())
                .doOnNext(name -> names.put(key, name))
                .onErrorResume(e -> {
                    log.warn("NAME_LOOKUP_FAILED key={} reason={}", key, e.getMessage());
                    return Mono.empty();
                });
        });
    }

    /** Number of refreshes currently running. */
    public int inFlightCount() {
        return inFlight.size();
    }

    @SuppressWarnings("unchecked")
    private <T> Mono<T> cached(DataCategory category, ResolvedSymbol symbol, Supplier<Mono<T>> upstream) {
        String key = symbol.cacheKey();
        return Mono.defer(() -> {
            Optional<T> hit = cache.get(category, key);
            if (hit.isPresent()) {
                log.info("CACHE_HIT category={} key={}", category, key);
                return Mono.just(hit.get());
            }
            FlightKey flightKey = new FlightKey(category, key);
            return (Mono<T>) inFlight.computeIfAbsent(flightKey, k -> {
                log.info("CACHE_MISS category={} key={}", category, key);
                return refresh(category, symbol, upstream, k);
            });
        });
    }

    private <T> Mono<T> refresh(DataCategory category, ResolvedSymbol symbol,
                                Supplier<Mono<T>> upstream, FlightKey flightKey) {
        long start = System.currentTimeMillis();
        return Mono.defer(upstream)
            .timeout(fetchTimeout)
            .switchIfEmpty(Mono.error(() ->
                new FetchException(category, symbol.symbol(), "Upstream returned no data")))
            .doOnNext(value -> {
                cache.put(category, flightKey.key(), value);
                log.info("FETCH_OK category={} key={} latencyMs={}",
                         category, flightKey.key(), System.currentTimeMillis() - start);
            })
            .onErrorMap(e -> !(e instanceof FetchException), e -> toFetchException(category, symbol, e))
            .doOnError(e -> log.warn("FETCH_FAILED category={} key={} reason={}",
                                     category, flightKey.key(), e.getMessage()))
            .doFinally(signal -> inFlight.remove(flightKey))
            .cache();
    }

    private FetchException toFetchException(DataCategory category, ResolvedSymbol symbol, Throwable e) {
        if (e instanceof TimeoutException) {
            return new FetchException(category, symbol.symbol(),
                "Upstream fetch timed out after " + fetchTimeout.toMillis() + "ms", e);
        }
        return new FetchException(category, symbol.symbol(), "Upstream fetch failed: " + e.getMessage(), e);
    }
}
