package com.stockinsight.marketdata.cache;

import com.stockinsight.common.model.DataCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache partitioned by {@link DataCategory}, each category with its own TTL.
 *
 * <p>There is no size-based eviction. Expired entries are removed lazily when a lookup
 * finds them. Thread-safe via {@link ConcurrentHashMap}: reads never block and writes are
 * atomic per key. No method ever throws; a miss is an empty {@link Optional}.
 */
public class TtlCache {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private record Key(DataCategory category, String key) {}

    private final ConcurrentHashMap<Key, CacheEntry<?>> store = new ConcurrentHashMap<>();
    private final CacheSettings settings;
    private final Clock clock;

    public TtlCache(CacheSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Returns the payload stored under {@code (category, key)} if it has not expired.
     * The caller is expected to read back the type it stored for the category.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(DataCategory category, String key) {
        Key k = new Key(category, key);
        CacheEntry<?> entry = store.get(k);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isValidAt(clock.instant())) {
            // conditional remove: a concurrent refresh must survive
            store.remove(k, entry);
            log.debug("CACHE_EXPIRED category={} key={} fetchedAt={}", category, key, entry.fetchedAt());
            return Optional.empty();
        }
        return Optional.of((T) entry.payload());
    }

    /** Stores or replaces the entry, stamped now with the category's TTL. */
    public <T> void put(DataCategory category, String key, T value) {
        Instant now = clock.instant();
        store.put(new Key(category, key), new CacheEntry<>(value, now, settings.ttlFor(category)));
        log.info("CACHE_REFRESH category={} key={} ttlSeconds={}",
                 category, key, settings.ttlFor(category).toSeconds());
    }

    /** Entries currently held, including expired ones not yet looked up. */
    public int size() {
        return store.size();
    }

    public CacheSettings settings() {
        return settings;
    }
}
