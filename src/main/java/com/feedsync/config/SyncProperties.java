package com.feedsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "app.sync")
public class SyncProperties {

    @Valid
    private Upstream upstream = new Upstream();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Content content = new Content();

    @Min(1)
    private int maxPages = 50;

    @Min(1)
    private int workerPoolSize = 4;

    @Data
    public static class Upstream {
        @NotBlank
        private String baseUrl = "http://localhost:4000";
        private String authCode;
        @NotNull
        private UpstreamFormat format = UpstreamFormat.JSON;
        @Min(1)
        private int pageSize = 20;
        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(30);
        @Min(0)
        private int maxRetries = 0;
        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int maxRequests = 30;
        @NotNull
        private Duration window = Duration.ofSeconds(60);
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        @NotNull
        private Duration ttl = Duration.ofMinutes(30);
        @Min(1)
        private long maxEntries = 1000;
    }

    @Data
    public static class Content {
        @Min(20)
        private int summaryLength = 200;
        @Min(1)
        private int wordsPerMinute = 200;
    }

    public enum UpstreamFormat {
        JSON("json"),
        RSS("rss");

        private final String extension;

        UpstreamFormat(String extension) {
            this.extension = extension;
        }

        public String getExtension() {
            return extension;
        }
    }
}
