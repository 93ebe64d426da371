package com.feedsync.service.ratelimit;

import com.feedsync.service.sync.SyncCancellation;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Rolling-window limiter for outbound upstream calls: at most {@code maxRequests} grants in any
 * {@code window}. Each caller reserves the earliest free slot under the lock, so waiting callers
 * are released in arrival order. A reservation is never refused, only delayed.
 */
@Slf4j
public class RateLimiter {

    private final int maxRequests;
    private final long windowNanos;
    private final Scheduler scheduler;

    // last maxRequests granted slots, ascending; may hold slots in the future
    private final Deque<Long> grants = new ArrayDeque<>();

    public RateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, Schedulers.parallel());
    }

    public RateLimiter(int maxRequests, Duration window, Scheduler scheduler) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.scheduler = scheduler;
    }

    public Mono<Void> acquire(SyncCancellation cancellation) {
        return cancellation.check().then(Mono.defer(() -> {
            Duration wait = reserve();
            if (wait.isZero()) {
                return Mono.<Void>empty();
            }
            log.debug("Rate limit reached, feed {} waits {} ms", cancellation.getFeedId(), wait.toMillis());
            return Mono.firstWithSignal(
                    Mono.delay(wait, scheduler).then(),
                    cancellation.<Void>whenCancelled());
        }));
    }

    synchronized Duration reserve() {
        long now = scheduler.now(TimeUnit.NANOSECONDS);
        long slot = now;
        if (grants.size() >= maxRequests) {
            slot = Math.max(now, grants.pollFirst() + windowNanos);
        }
        grants.addLast(slot);
        return Duration.ofNanos(slot - now);
    }
}
