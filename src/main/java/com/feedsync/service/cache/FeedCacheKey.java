package com.feedsync.service.cache;

import com.feedsync.service.feed.FeedCursor;

public record FeedCacheKey(String feedId, FeedCursor cursor, int pageSize) {
}
