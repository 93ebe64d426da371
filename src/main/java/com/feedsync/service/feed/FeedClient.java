package com.feedsync.service.feed;

import com.feedsync.config.SyncProperties;
import com.feedsync.exception.FetchException;
import com.feedsync.exception.SyncCancelledException;
import com.feedsync.model.Account;
import com.feedsync.service.cache.FeedCacheKey;
import com.feedsync.service.cache.ResponseCache;
import com.feedsync.service.ratelimit.RateLimiter;
import com.feedsync.service.sync.SyncCancellation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fetches pages of a feed from the upstream source. Every call takes a rate-limit slot first and
 * then consults the response cache; only a miss reaches the network.
 */
@Slf4j
@Service
public class FeedClient {

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final ResponseCache<ParsedFeed> responseCache;
    private final SyncProperties properties;
    private final FeedPayloadParser parser;

    public FeedClient(WebClient upstreamWebClient,
                      RateLimiter rateLimiter,
                      ResponseCache<ParsedFeed> responseCache,
                      SyncProperties properties,
                      List<FeedPayloadParser> parsers) {
        this.webClient = upstreamWebClient;
        this.rateLimiter = rateLimiter;
        this.responseCache = responseCache;
        this.properties = properties;
        SyncProperties.UpstreamFormat format = properties.getUpstream().getFormat();
        this.parser = parsers.stream()
                .filter(p -> p.format() == format)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No payload parser for upstream format " + format));
    }

    public Mono<FeedPage> fetchPage(Account account, FeedCursor cursor, SyncCancellation cancellation) {
        int pageSize = properties.getUpstream().getPageSize();
        return fetchParsed(account.getFeedId(), cursor, cancellation)
                .map(parsed -> FeedPage.of(parsed.items(), cursor, pageSize))
                .doOnNext(page -> log.debug("Feed {} {}: {} items, hasMore={}",
                        account.getFeedId(), cursor, page.items().size(), page.hasMore()));
    }

    /**
     * Feed-level metadata (title, description, icon) taken from the first page.
     */
    public Mono<FeedMetadata> fetchMetadata(String feedId) {
        return fetchParsed(feedId, FeedCursor.first(), SyncCancellation.never(feedId))
                .map(ParsedFeed::metadata);
    }

    /**
     * Like {@link #fetchMetadata} but drops the feed's cached pages first, so the result reflects
     * the upstream as it is now.
     */
    public Mono<FeedMetadata> refreshMetadata(String feedId) {
        return Mono.fromRunnable(() -> responseCache.invalidateFeed(feedId))
                .then(fetchMetadata(feedId));
    }

    public String feedUrl(String feedId) {
        SyncProperties.Upstream upstream = properties.getUpstream();
        return upstream.getBaseUrl().replaceAll("/+$", "")
                + "/feeds/" + feedId + "." + upstream.getFormat().getExtension();
    }

    private Mono<ParsedFeed> fetchParsed(String feedId, FeedCursor cursor, SyncCancellation cancellation) {
        FeedCacheKey key = new FeedCacheKey(feedId, cursor, properties.getUpstream().getPageSize());
        return rateLimiter.acquire(cancellation)
                .then(Mono.defer(() -> responseCache.get(key)
                        .map(Mono::just)
                        .orElseGet(() -> requestWithRetry(feedId, cursor, cancellation)
                                .doOnNext(parsed -> responseCache.put(key, parsed)))));
    }

    private Mono<ParsedFeed> requestWithRetry(String feedId, FeedCursor cursor, SyncCancellation cancellation) {
        SyncProperties.Upstream upstream = properties.getUpstream();
        Mono<ParsedFeed> request = requestUpstream(feedId, cursor);
        if (upstream.getMaxRetries() <= 0) {
            return request;
        }
        return request.retryWhen(Retry.backoff(upstream.getMaxRetries(), upstream.getRetryBackoff())
                .maxBackoff(upstream.getRetryBackoff().multipliedBy(8))
                .filter(this::isRetryableError)
                .doBeforeRetryAsync(signal -> {
                    log.warn("Retry {} for feed {} at {} after: {}",
                            signal.totalRetries() + 1, feedId, cursor, signal.failure().getMessage());
                    return rateLimiter.acquire(cancellation);
                })
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
    }

    private Mono<ParsedFeed> requestUpstream(String feedId, FeedCursor cursor) {
        SyncProperties.Upstream upstream = properties.getUpstream();
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/feeds/{feedId}.{extension}")
                        .queryParam("limit", upstream.getPageSize())
                        .queryParam("page", cursor.page())
                        .build(feedId, upstream.getFormat().getExtension()))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(upstream.getFetchTimeout())
                .switchIfEmpty(Mono.error(() -> new FetchException(feedId, cursor, "empty response body")))
                .doOnSubscribe(s -> log.debug("Requesting feed {} {}", feedId, cursor))
                .map(body -> parser.parse(feedId, cursor, body))
                .onErrorMap(error -> !(error instanceof FetchException || error instanceof SyncCancelledException),
                        error -> toFetchException(feedId, cursor, error));
    }

    private FetchException toFetchException(String feedId, FeedCursor cursor, Throwable error) {
        if (error instanceof WebClientResponseException webEx) {
            log.warn("Upstream returned {} for feed {} at {}", webEx.getStatusCode().value(), feedId, cursor);
            return new FetchException(feedId, cursor, "upstream status " + webEx.getStatusCode().value(),
                    webEx.getStatusCode().value(), webEx);
        }
        if (error instanceof TimeoutException) {
            log.warn("Upstream timeout ({}) for feed {} at {}", properties.getUpstream().getFetchTimeout(), feedId, cursor);
            return new FetchException(feedId, cursor, "timed out after " + properties.getUpstream().getFetchTimeout(),
                    null, error);
        }
        if (error instanceof WebClientRequestException) {
            log.warn("Upstream unreachable for feed {} at {}: {}", feedId, cursor, error.getMessage());
            return new FetchException(feedId, cursor, "transport error: " + error.getMessage(), null, error);
        }
        log.error("Unexpected upstream failure for feed {} at {}: {}", feedId, cursor, error.getMessage(), error);
        return new FetchException(feedId, cursor, error.getMessage(), null, error);
    }

    private boolean isRetryableError(Throwable error) {
        if (!(error instanceof FetchException fetchException)) {
            return false;
        }
        Integer status = fetchException.getHttpStatus();
        if (status != null) {
            return status >= 500 || status == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return fetchException.getCause() instanceof TimeoutException
                || fetchException.getCause() instanceof WebClientRequestException;
    }
}
