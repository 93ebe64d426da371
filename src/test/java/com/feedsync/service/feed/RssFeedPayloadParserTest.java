package com.feedsync.service.feed;

import com.feedsync.exception.FetchException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RssFeedPayloadParserTest {

    private final RssFeedPayloadParser parser = new RssFeedPayloadParser();

    @Test
    void parse_shouldMapRssEntries() {
        String body = """
                <?xml version="1.0" encoding="UTF-8"?>
                <rss version="2.0">
                  <channel>
                    <title>Tech Daily</title>
                    <link>https://example.com</link>
                    <description>Daily tech digest</description>
                    <item>
                      <title>First post</title>
                      <link>https://example.com/posts/1</link>
                      <guid>g1</guid>
                      <author>alice@example.com (Alice)</author>
                      <pubDate>Wed, 01 May 2024 10:15:30 GMT</pubDate>
                      <description><![CDATA[<p>Hello<br>world</p>]]></description>
                      <enclosure url="https://img.example.com/cover.jpg" length="100" type="image/jpeg"/>
                    </item>
                    <item>
                      <title>Second post</title>
                      <link>https://example.com/posts/2</link>
                    </item>
                  </channel>
                </rss>
                """;

        ParsedFeed parsed = parser.parse("feed-a", FeedCursor.first(), body);

        assertEquals("Tech Daily", parsed.metadata().getTitle());
        List<FeedItem> items = parsed.items();
        assertEquals(2, items.size());

        FeedItem first = items.get(0);
        assertEquals("g1", first.getGuid());
        assertEquals("https://example.com/posts/1", first.getLink());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 15, 30), first.getPublishedAt());
        assertTrue(first.getHtmlBody().contains("Hello"));
        assertEquals("https://img.example.com/cover.jpg", first.getCoverImageUrl());

        assertEquals("https://example.com/posts/2", items.get(1).getGuid());
    }

    @Test
    void parse_shouldRejectNonFeedPayload() {
        assertThrows(FetchException.class,
                () -> parser.parse("feed-a", FeedCursor.first(), "<html><body>gateway error</body></html>"));
    }
}
