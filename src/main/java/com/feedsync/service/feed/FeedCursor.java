package com.feedsync.service.feed;

/**
 * Position in an upstream feed. The upstream pages by 1-based page number.
 */
public record FeedCursor(int page) {

    public FeedCursor {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, was " + page);
        }
    }

    public static FeedCursor first() {
        return new FeedCursor(1);
    }

    public FeedCursor next() {
        return new FeedCursor(page + 1);
    }

    @Override
    public String toString() {
        return "page " + page;
    }
}
