package com.feedsync.service.content;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class NormalizedArticle {
    String guid;
    String title;
    String author;
    String url;
    String contentHtml;
    String content;
    String summary;
    List<String> imageUrls;
    String coverImage;
    LocalDateTime publishedAt;
    int wordCount;
    int readingTimeMinutes;
}
