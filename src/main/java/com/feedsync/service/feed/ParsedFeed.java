package com.feedsync.service.feed;

import java.util.List;

public record ParsedFeed(FeedMetadata metadata, List<FeedItem> items) {

    public ParsedFeed {
        items = List.copyOf(items);
    }
}
