package com.feedsync.service.feed;

import com.feedsync.config.SyncProperties;
import com.feedsync.exception.FetchException;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * RSS and Atom upstream payloads, parsed with Rome.
 */
@Slf4j
@Component
public class RssFeedPayloadParser implements FeedPayloadParser {

    @Override
    public SyncProperties.UpstreamFormat format() {
        return SyncProperties.UpstreamFormat.RSS;
    }

    @Override
    public ParsedFeed parse(String feedId, FeedCursor cursor, String body) {
        SyndFeed feed;
        try {
            SyndFeedInput input = new SyndFeedInput();
            input.setPreserveWireFeed(false);
            feed = input.build(new StringReader(fixSelfClosingTags(body)));
        } catch (FeedException | IllegalArgumentException e) {
            throw new FetchException(feedId, cursor, "malformed RSS feed: " + e.getMessage(), null, e);
        }

        List<FeedItem> items = new ArrayList<>(feed.getEntries().size());
        for (int i = 0; i < feed.getEntries().size(); i++) {
            items.add(toFeedItem(feedId, cursor, i, feed.getEntries().get(i)));
        }

        FeedMetadata metadata = FeedMetadata.builder()
                .title(feed.getTitle())
                .description(feed.getDescription())
                .iconUrl(feed.getImage() != null ? feed.getImage().getUrl() : null)
                .build();

        log.debug("Parsed {} RSS entries for feed {} at {}", items.size(), feedId, cursor);
        return new ParsedFeed(metadata, items);
    }

    private FeedItem toFeedItem(String feedId, FeedCursor cursor, int index, SyndEntry entry) {
        String guid = entry.getUri() != null && !entry.getUri().isBlank() ? entry.getUri() : entry.getLink();
        if (guid == null || guid.isBlank()) {
            throw new FetchException(feedId, cursor, "entry " + index + " has neither guid nor link");
        }

        String html = null;
        if (!entry.getContents().isEmpty() && entry.getContents().get(0).getValue() != null) {
            html = entry.getContents().get(0).getValue();
        } else if (entry.getDescription() != null) {
            html = entry.getDescription().getValue();
        }

        SyndContent description = entry.getDescription();
        String summary = html != null && description != null && !html.equals(description.getValue())
                ? description.getValue()
                : null;

        return FeedItem.builder()
                .guid(guid.trim())
                .title(entry.getTitle())
                .author(entry.getAuthor())
                .link(entry.getLink())
                .publishedAt(FeedDates.fromDate(entry.getPublishedDate() != null
                        ? entry.getPublishedDate()
                        : entry.getUpdatedDate()))
                .htmlBody(html)
                .summary(summary)
                .coverImageUrl(findImageEnclosure(entry))
                .build();
    }

    private String findImageEnclosure(SyndEntry entry) {
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            if (enclosure.getType() != null && enclosure.getType().startsWith("image/")) {
                return enclosure.getUrl();
            }
        }
        return null;
    }

    // Some upstreams emit HTML void elements unclosed inside the XML, which Rome rejects.
    private String fixSelfClosingTags(String content) {
        return content
                .replaceAll("<hr[^>]*(?<!/)>", "<hr/>")
                .replaceAll("<br[^>]*(?<!/)>", "<br/>")
                .replaceAll("<img([^>]*?)(?<!/)>", "<img$1/>")
                .replaceAll("<meta([^>]*?)(?<!/)>", "<meta$1/>");
    }
}
