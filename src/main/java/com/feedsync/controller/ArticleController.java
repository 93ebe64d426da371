package com.feedsync.controller;

import com.feedsync.dto.ArticleFlagsRequest;
import com.feedsync.model.Article;
import com.feedsync.service.article.ArticleQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/articles")
@RequiredArgsConstructor
public class ArticleController {
    private final ArticleQueryService articleQueryService;

    @GetMapping
    public Flux<Article> find(@RequestParam(required = false) String feedId,
                              @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
                              @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
                              @RequestParam(defaultValue = "100") int limit) {
        return articleQueryService.findArticles(feedId, from, to, limit);
    }

    @PutMapping("/{id}/flags")
    public Mono<Article> updateFlags(@PathVariable Long id, @RequestBody ArticleFlagsRequest request) {
        return articleQueryService.updateFlags(id, request);
    }
}
