package com.stockinsight.marketdata.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockinsight.common.model.FinancialIndicator;
import com.stockinsight.common.model.FinancialIndicatorSet;
import com.stockinsight.common.model.Market;
import com.stockinsight.common.model.NewsCategory;
import com.stockinsight.common.model.NewsItem;
import com.stockinsight.common.model.PriceBar;
import com.stockinsight.common.model.PriceSeries;
import com.stockinsight.marketdata.provider.FinancialDataProvider;
import com.stockinsight.marketdata.provider.NewsProvider;
import com.stockinsight.marketdata.provider.PriceSeriesProvider;
import com.stockinsight.marketdata.provider.StockNameProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * HTTP adapter for the market data gateway, the service that wraps the exchange and news
 * feeds. Implements all three collaborator contracts.
 *
 * <pre>
 *   GET /api/v1/prices/{symbol}?market=&amp;days=      {"symbol":…, "bars":[["2024-01-02",o,h,l,c,v], …]}
 *   GET /api/v1/financials/{symbol}?market=          {"symbol":…, "indicators":{"RETURN_ON_EQUITY":18.2, …}}
 *   GET /api/v1/news/{symbol}?market=&amp;limit=        {"items":[{"id":…, "timestamp":…, …}, …]}
 *   GET /api/v1/profile/{symbol}?market=             {"symbol":…, "name":"Kweichow Moutai"}
 * </pre>
 *
 * Bars may arrive in any order; they are sorted oldest-first and de-duplicated by date.
 * News items are sorted newest-first, undated items last.
 * Unknown indicator names and null values are skipped. A profile without a name yields no name.
 */
public class DataGatewayClient
    implements PriceSeriesProvider, FinancialDataProvider, NewsProvider, StockNameProvider {

    private static final Logger log = LoggerFactory.getLogger(DataGatewayClient.class);

    // Stable, so undated items keep gateway order behind the dated ones.
    private static final Comparator<NewsItem> NEWEST_FIRST =
        Comparator.comparing(NewsItem::timestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public DataGatewayClient(WebClient dataGatewayWebClient, ObjectMapper objectMapper) {
        this.webClient    = dataGatewayWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<PriceSeries> fetchPriceSeries(String symbol, Market market, int periodDays) {
        log.info("Fetching price series. symbol={} market={} days={}", symbol, market, periodDays);
        return webClient.get()
            .uri(b -> b.path("/api/v1/prices/{symbol}")
                .queryParam("market", market.name())
                .queryParam("days", periodDays)
                .build(symbol))
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parsePriceSeries(symbol, market, json));
    }

    @Override
    public Mono<FinancialIndicatorSet> fetchFinancialIndicators(String symbol, Market market) {
        log.info("Fetching financial indicators. symbol={} market={}", symbol, market);
        return webClient.get()
            .uri(b -> b.path("/api/v1/financials/{symbol}")
                .queryParam("market", market.name())
                .build(symbol))
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseFinancials(symbol, json));
    }

    @Override
    public Mono<List<NewsItem>> fetchNews(String symbol, Market market, int maxCount) {
        log.info("Fetching news. symbol={} market={} limit={}", symbol, market, maxCount);
        return webClient.get()
            .uri(b -> b.path("/api/v1/news/{symbol}")
                .queryParam("market", market.name())
                .queryParam("limit", maxCount)
                .build(symbol))
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseNews(symbol, json));
    }

    @Override
    public Mono<String> fetchStockName(String symbol, Market market) {
        log.debug("Fetching stock name. symbol={} market={}", symbol, market);
        return webClient.get()
            .uri(b -> b.path("/api/v1/profile/{symbol}")
                .queryParam("market", market.name())
                .build(symbol))
            .retrieve()
            .bodyToMono(String.class)
            .flatMap(json -> Mono.justOrEmpty(parseStockName(symbol, json)));
    }

    // ── parsing ─────────────────────────────────────────────────────────────

    PriceSeries parsePriceSeries(String symbol, Market market, String json) {
        JsonNode bars = readTree(json, symbol).path("bars");
        if (!bars.isArray()) {
            throw new IllegalStateException("Price response carries no bars array. symbol=" + symbol);
        }
        ZoneId zone = ZoneId.of(market.timezone());
        Map<Instant, PriceBar> byTime = new TreeMap<>();
        // Each entry: [date, open, high, low, close, volume]
        for (JsonNode bar : bars) {
            Instant ts = LocalDate.parse(bar.get(0).asText()).atStartOfDay(zone).toInstant();
            byTime.put(ts, PriceBar.of(ts,
                bar.get(1).asDouble(), bar.get(2).asDouble(), bar.get(3).asDouble(),
                bar.get(4).asDouble(), bar.get(5).asLong()));
        }
        return PriceSeries.of(symbol, new ArrayList<>(byTime.values()));
    }

    FinancialIndicatorSet parseFinancials(String symbol, String json) {
        JsonNode indicators = readTree(json, symbol).path("indicators");
        Map<FinancialIndicator, Double> values = new EnumMap<>(FinancialIndicator.class);
        Iterator<Map.Entry<String, JsonNode>> fields = indicators.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) continue;
            try {
                values.put(FinancialIndicator.valueOf(field.getKey().toUpperCase(Locale.ROOT)),
                           field.getValue().asDouble());
            } catch (IllegalArgumentException e) {
                log.debug("Skipping unknown financial indicator. symbol={} name={}", symbol, field.getKey());
            }
        }
        return FinancialIndicatorSet.of(symbol, values);
    }

    List<NewsItem> parseNews(String symbol, String json) {
        JsonNode items = readTree(json, symbol).path("items");
        List<NewsItem> news = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.hasNonNull("id")) continue;
            news.add(NewsItem.of(
                item.get("id").asText(),
                item.hasNonNull("timestamp") ? Instant.parse(item.get("timestamp").asText()) : null,
                item.path("source").asText(""),
                item.path("title").asText(""),
                item.path("body").asText(""),
                parseCategory(item.path("category").asText(""))));
        }
        news.sort(NEWEST_FIRST);
        return news;
    }

    String parseStockName(String symbol, String json) {
        String name = readTree(json, symbol).path("name").asText("").trim();
        return name.isEmpty() || name.equalsIgnoreCase(symbol) ? null : name;
    }

    private static NewsCategory parseCategory(String raw) {
        return switch (raw.toUpperCase(Locale.ROOT)) {
            case "ANNOUNCEMENT"    -> NewsCategory.ANNOUNCEMENT;
            case "RESEARCH_REPORT" -> NewsCategory.RESEARCH_REPORT;
            default                -> NewsCategory.COMPANY_NEWS;
        };
    }

    private JsonNode readTree(String json, String symbol) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed data gateway response. symbol=" + symbol, e);
        }
    }
}
