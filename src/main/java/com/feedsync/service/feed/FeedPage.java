package com.feedsync.service.feed;

import java.util.List;

/**
 * One page of upstream items. {@code hasMore == false} with a null {@code nextCursor} means the
 * feed is exhausted.
 */
public record FeedPage(List<FeedItem> items, FeedCursor nextCursor, boolean hasMore) {

    public FeedPage {
        items = List.copyOf(items);
        if (hasMore && nextCursor == null) {
            throw new IllegalArgumentException("nextCursor is required when hasMore is set");
        }
    }

    /**
     * A short page means the upstream has nothing past it.
     */
    static FeedPage of(List<FeedItem> items, FeedCursor cursor, int pageSize) {
        boolean hasMore = items.size() >= pageSize;
        return new FeedPage(items, hasMore ? cursor.next() : null, hasMore);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
