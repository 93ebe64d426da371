package com.feedsync.service.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Wire shape of a JSON Feed (https://jsonfeed.org) document as served by the upstream.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonFeedDocument {

    private String title;
    private String description;

    private String icon;
    private String favicon;

    private List<Item> items;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        private String id;
        private String url;
        private String title;
        private String summary;
        private String image;

        @JsonProperty("content_html")
        private String contentHtml;

        @JsonProperty("content_text")
        private String contentText;

        @JsonProperty("date_published")
        private String datePublished;

        @JsonProperty("date_modified")
        private String dateModified;

        private Author author;
        private List<Author> authors;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Author {
        private String name;
    }
}
