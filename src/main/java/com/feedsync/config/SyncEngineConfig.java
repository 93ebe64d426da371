package com.feedsync.config;

import com.feedsync.service.cache.ResponseCache;
import com.feedsync.service.feed.ParsedFeed;
import com.feedsync.service.ratelimit.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The rate limiter and response cache are shared by every worker, so they are built once here
 * and injected explicitly rather than reached through statics.
 */
@Configuration(proxyBeanMethods = false)
public class SyncEngineConfig {

    @Bean
    public RateLimiter upstreamRateLimiter(SyncProperties properties) {
        SyncProperties.RateLimit rateLimit = properties.getRateLimit();
        return new RateLimiter(rateLimit.getMaxRequests(), rateLimit.getWindow());
    }

    @Bean
    public ResponseCache<ParsedFeed> feedResponseCache(SyncProperties properties) {
        SyncProperties.Cache cache = properties.getCache();
        return new ResponseCache<>(cache.isEnabled(), cache.getTtl(), cache.getMaxEntries());
    }
}
