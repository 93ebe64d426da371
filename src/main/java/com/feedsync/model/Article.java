package com.feedsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One upstream content item. {@code (accountId, guid)} is unique and {@code guid} never changes
 * once stored. The read and favorite flags belong to the user and are never written by a sync.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"contentHtml", "content"})
@Table("articles")
public class Article {
    @Id
    private Long id;

    @Column("account_id")
    private Long accountId;

    @Column("guid")
    private String guid;

    @Column("title")
    private String title;

    @Column("author")
    private String author;

    @Column("url")
    private String url;

    @Column("content_html")
    private String contentHtml;

    @Column("content")
    private String content;

    @Column("summary")
    private String summary;

    @Column("image_urls")
    private List<String> imageUrls;

    @Column("cover_image")
    private String coverImage;

    @Column("published_at")
    private LocalDateTime publishedAt;

    @Column("word_count")
    private Integer wordCount;

    @Column("reading_time_minutes")
    private Integer readingTimeMinutes;

    @Column("is_read")
    private Boolean read;

    @Column("is_favorite")
    private Boolean favorite;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
