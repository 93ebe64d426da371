package com.feedsync.service.feed;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One validated upstream entry. {@code guid} is always present; everything else may be blank.
 */
@Value
@Builder
public class FeedItem {
    String guid;
    String title;
    String author;
    String link;
    LocalDateTime publishedAt;
    String htmlBody;
    String summary;
    String coverImageUrl;
}
