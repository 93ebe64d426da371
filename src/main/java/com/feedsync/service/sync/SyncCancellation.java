package com.feedsync.service.sync;

import com.feedsync.exception.SyncCancelledException;
import lombok.Getter;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation handle for one run. Checked before every page fetch and observed
 * by the rate limiter while a caller waits for a slot.
 */
public class SyncCancellation {

    @Getter
    private final String feedId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.Empty<Void> signal = Sinks.empty();

    public SyncCancellation(String feedId) {
        this.feedId = feedId;
    }

    public static SyncCancellation never(String feedId) {
        return new SyncCancellation(feedId);
    }

    /**
     * @return true if this call flipped the handle, false if it was already cancelled
     */
    public boolean cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitEmpty();
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Errors with {@link SyncCancelledException} once {@link #cancel()} is called; never
     * completes otherwise.
     */
    public <T> Mono<T> whenCancelled() {
        return signal.asMono().then(Mono.error(() -> new SyncCancelledException(feedId)));
    }

    public Mono<Void> check() {
        return Mono.defer(() -> isCancelled()
                ? Mono.error(new SyncCancelledException(feedId))
                : Mono.empty());
    }
}
