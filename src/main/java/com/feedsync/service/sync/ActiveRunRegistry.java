package com.feedsync.service.sync;

import com.feedsync.exception.SyncAlreadyRunningException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * At most one active run per feed in this process. A second start is refused, not queued.
 */
@Component
public class ActiveRunRegistry {

    private final ConcurrentMap<String, SyncCancellation> active = new ConcurrentHashMap<>();

    public SyncCancellation register(String feedId) {
        SyncCancellation cancellation = new SyncCancellation(feedId);
        if (active.putIfAbsent(feedId, cancellation) != null) {
            throw new SyncAlreadyRunningException(feedId);
        }
        return cancellation;
    }

    public void release(String feedId, SyncCancellation cancellation) {
        active.remove(feedId, cancellation);
    }

    /**
     * @return false if no run is active for the feed
     */
    public boolean cancel(String feedId) {
        SyncCancellation cancellation = active.get(feedId);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel();
        return true;
    }

    public boolean isActive(String feedId) {
        return active.containsKey(feedId);
    }
}
