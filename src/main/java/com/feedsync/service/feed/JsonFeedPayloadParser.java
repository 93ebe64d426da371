package com.feedsync.service.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.feedsync.config.SyncProperties;
import com.feedsync.exception.FetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsonFeedPayloadParser implements FeedPayloadParser {

    private final ObjectMapper objectMapper;

    @Override
    public SyncProperties.UpstreamFormat format() {
        return SyncProperties.UpstreamFormat.JSON;
    }

    @Override
    public ParsedFeed parse(String feedId, FeedCursor cursor, String body) {
        JsonFeedDocument document;
        try {
            document = objectMapper.readValue(body, JsonFeedDocument.class);
        } catch (JsonProcessingException e) {
            throw new FetchException(feedId, cursor, "malformed JSON feed: " + e.getOriginalMessage(), null, e);
        }
        if (document == null || document.getItems() == null) {
            throw new FetchException(feedId, cursor, "JSON feed has no items array");
        }

        List<FeedItem> items = new ArrayList<>(document.getItems().size());
        for (int i = 0; i < document.getItems().size(); i++) {
            JsonFeedDocument.Item raw = document.getItems().get(i);
            if (raw == null) {
                throw new FetchException(feedId, cursor, "item " + i + " is null");
            }
            items.add(toFeedItem(feedId, cursor, i, raw));
        }

        FeedMetadata metadata = FeedMetadata.builder()
                .title(document.getTitle())
                .description(document.getDescription())
                .iconUrl(document.getIcon() != null ? document.getIcon() : document.getFavicon())
                .build();

        log.debug("Parsed {} items for feed {} at {}", items.size(), feedId, cursor);
        return new ParsedFeed(metadata, items);
    }

    private FeedItem toFeedItem(String feedId, FeedCursor cursor, int index, JsonFeedDocument.Item raw) {
        String guid = firstNonBlank(raw.getId(), raw.getUrl());
        if (guid == null) {
            throw new FetchException(feedId, cursor, "item " + index + " has neither id nor url");
        }

        String published = firstNonBlank(raw.getDatePublished(), raw.getDateModified());

        return FeedItem.builder()
                .guid(guid.trim())
                .title(raw.getTitle())
                .author(resolveAuthor(raw))
                .link(firstNonBlank(raw.getUrl(), raw.getId()))
                .publishedAt(FeedDates.parse(published))
                .htmlBody(firstNonBlank(raw.getContentHtml(), raw.getContentText()))
                .summary(raw.getSummary())
                .coverImageUrl(raw.getImage())
                .build();
    }

    private String resolveAuthor(JsonFeedDocument.Item raw) {
        if (raw.getAuthors() != null && !raw.getAuthors().isEmpty()) {
            String joined = raw.getAuthors().stream()
                    .filter(Objects::nonNull)
                    .map(JsonFeedDocument.Author::getName)
                    .filter(name -> name != null && !name.isBlank())
                    .collect(Collectors.joining(", "));
            if (!joined.isEmpty()) {
                return joined;
            }
        }
        return raw.getAuthor() != null ? raw.getAuthor().getName() : null;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
