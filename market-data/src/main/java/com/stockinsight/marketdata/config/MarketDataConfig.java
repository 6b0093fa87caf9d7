package com.stockinsight.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockinsight.marketdata.cache.CacheSettings;
import com.stockinsight.marketdata.cache.TtlCache;
import com.stockinsight.marketdata.client.DataGatewayClient;
import com.stockinsight.marketdata.service.MarketDataService;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class MarketDataConfig {

    @Value("${data-gateway.base-url:http://localhost:8090}")
    private String baseUrl;

    @Value("${analysis.fetch.timeout:15s}")
    private Duration fetchTimeout;

    @Value("${analysis.technical.period-days:180}")
    private int periodDays;

    @Value("${analysis.sentiment.max-items:100}")
    private int maxNews;

    @Value("${analysis.cache.price-ttl:1h}")
    private Duration priceTtl;

    @Value("${analysis.cache.fundamental-ttl:6h}")
    private Duration fundamentalTtl;

    @Value("${analysis.cache.news-ttl:2h}")
    private Duration newsTtl;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebClient dataGatewayWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(fetchTimeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(fetchTimeout.toSeconds() + 1, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public DataGatewayClient dataGatewayClient(WebClient dataGatewayWebClient, ObjectMapper objectMapper) {
        return new DataGatewayClient(dataGatewayWebClient, objectMapper);
    }

    @Bean
    public TtlCache ttlCache(Clock clock) {
        return new TtlCache(new CacheSettings(priceTtl, fundamentalTtl, newsTtl), clock);
    }

    @Bean
    public MarketDataService marketDataService(DataGatewayClient dataGatewayClient, TtlCache ttlCache) {
        return new MarketDataService(dataGatewayClient, dataGatewayClient, dataGatewayClient, dataGatewayClient,
            ttlCache, fetchTimeout, periodDays, maxNews);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(MarketDataConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
