package com.feedsync.service.feed;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeedMetadata {
    String title;
    String description;
    String iconUrl;
}
