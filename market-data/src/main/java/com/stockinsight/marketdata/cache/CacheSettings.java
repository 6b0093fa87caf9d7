package com.stockinsight.marketdata.cache;

import com.stockinsight.common.exception.ConfigurationException;
import com.stockinsight.common.model.DataCategory;

import java.time.Duration;

public record CacheSettings(Duration priceTtl, Duration fundamentalTtl, Duration newsTtl) {

    public CacheSettings {
        requirePositive("price", priceTtl);
        requirePositive("fundamental", fundamentalTtl);
        requirePositive("news", newsTtl);
    }

    public static CacheSettings defaults() {
        return new CacheSettings(Duration.ofHours(1), Duration.ofHours(6), Duration.ofHours(2));
    }

    public Duration ttlFor(DataCategory category) {
        return switch (category) {
            case PRICE       -> priceTtl;
            case FUNDAMENTAL -> fundamentalTtl;
            case NEWS        -> newsTtl;
        };
    }

    private static void requirePositive(String name, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new ConfigurationException("Cache TTL for " + name + " must be positive but was " + ttl);
        }
    }
}
