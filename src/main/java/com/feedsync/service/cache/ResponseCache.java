package com.feedsync.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived cache of upstream fetch results, bounded in size and expiring entries a fixed time
 * after they were written. A miss is always safe: callers fall through to the upstream call.
 */
@Slf4j
public class ResponseCache<V> {

    private final boolean enabled;
    private final Cache<FeedCacheKey, V> entries;

    public ResponseCache(boolean enabled, Duration ttl, long maximumSize) {
        this(enabled, ttl, maximumSize, Ticker.systemTicker());
    }

    public ResponseCache(boolean enabled, Duration ttl, long maximumSize, Ticker ticker) {
        this.enabled = enabled;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Optional<V> get(FeedCacheKey key) {
        if (!enabled) {
            return Optional.empty();
        }
        V value = entries.getIfPresent(key);
        if (value != null) {
            log.debug("Cache hit: {}", key);
        }
        return Optional.ofNullable(value);
    }

    public void put(FeedCacheKey key, V value) {
        if (enabled) {
            entries.put(key, value);
        }
    }

    public void invalidateFeed(String feedId) {
        entries.asMap().keySet().removeIf(key -> key.feedId().equals(feedId));
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
