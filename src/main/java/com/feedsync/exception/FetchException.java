package com.feedsync.exception;

import com.feedsync.service.feed.FeedCursor;
import lombok.Getter;

/**
 * Upstream transport or payload failure for one page of one feed. A later run may succeed,
 * so this is never read as "no more items".
 */
@Getter
public class FetchException extends RuntimeException {

    private final String feedId;
    private final FeedCursor cursor;
    private final Integer httpStatus;

    public FetchException(String feedId, FeedCursor cursor, String message) {
        this(feedId, cursor, message, null, null);
    }

    public FetchException(String feedId, FeedCursor cursor, String message, Integer httpStatus, Throwable cause) {
        super("Fetch failed for feed " + feedId + " at " + cursor + ": " + message, cause);
        this.feedId = feedId;
        this.cursor = cursor;
        this.httpStatus = httpStatus;
    }
}
