package com.feedsync.service.feed;

import com.feedsync.config.SyncProperties;
import com.feedsync.exception.FetchException;

/**
 * Turns a raw upstream response body into validated feed items.
 */
public interface FeedPayloadParser {

    SyncProperties.UpstreamFormat format();

    /**
     * @throws FetchException if the body is not a well-formed feed or an item lacks an identifier
     */
    ParsedFeed parse(String feedId, FeedCursor cursor, String body);
}
