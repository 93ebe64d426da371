package com.feedsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration(proxyBeanMethods = false)
public class WebClientConfig {

    private static final int MAX_FEED_BYTES = 16 * 1024 * 1024;

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder builder, SyncProperties properties) {
        SyncProperties.Upstream upstream = properties.getUpstream();
        log.info("Upstream feed source: {} (format: {})", upstream.getBaseUrl(), upstream.getFormat());

        WebClient.Builder configured = builder
                .baseUrl(upstream.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, "feed-sync/0.1")
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_FEED_BYTES))
                        .build());

        if (upstream.getAuthCode() != null && !upstream.getAuthCode().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + upstream.getAuthCode());
        }
        return configured.build();
    }
}
