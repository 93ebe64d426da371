package com.feedsync.service.article;

import com.feedsync.dto.ArticleFlagsRequest;
import com.feedsync.exception.AccountNotFoundException;
import com.feedsync.exception.ArticleNotFoundException;
import com.feedsync.model.Article;
import com.feedsync.repository.AccountRepository;
import com.feedsync.repository.ArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Read side used by exporters and the API, plus the user flag writer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleQueryService {

    static final int MAX_LIMIT = 1000;
    private static final LocalDateTime EARLIEST = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime LATEST = LocalDateTime.of(9999, 12, 31, 0, 0);

    private final ArticleRepository articleRepository;
    private final AccountRepository accountRepository;

    /**
     * Articles published in {@code [from, to)}, newest first. Null bounds are open; when both are
     * null the listing also carries articles the upstream sent without a date.
     */
    public Flux<Article> findArticles(String feedId, LocalDateTime from, LocalDateTime to, int limit) {
        LocalDateTime lower = from != null ? from : EARLIEST;
        LocalDateTime upper = to != null ? to : LATEST;
        if (!lower.isBefore(upper)) {
            return Flux.error(new IllegalArgumentException("'from' must be before 'to'"));
        }
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        boolean includeUndated = from == null && to == null;

        if (feedId == null || feedId.isBlank()) {
            return articleRepository.findPublishedBetween(lower, upper, includeUndated, bounded);
        }
        return accountRepository.findByFeedId(feedId)
                .switchIfEmpty(Mono.error(() -> new AccountNotFoundException(feedId)))
                .flatMapMany(account -> articleRepository.findPublishedBetweenForAccount(account.getId(), lower, upper, includeUndated, bounded));
    }

    public Mono<Article> updateFlags(Long articleId, ArticleFlagsRequest request) {
        return articleRepository.findById(articleId)
                .switchIfEmpty(Mono.error(() -> new ArticleNotFoundException(articleId)))
                .flatMap(article -> {
                    boolean read = request.getRead() != null ? request.getRead() : Boolean.TRUE.equals(article.getRead());
                    boolean favorite = request.getFavorite() != null ? request.getFavorite() : Boolean.TRUE.equals(article.getFavorite());
                    return articleRepository.updateFlags(articleId, read, favorite)
                            .then(Mono.fromSupplier(() -> {
                                article.setRead(read);
                                article.setFavorite(favorite);
                                return article;
                            }));
                })
                .doOnSuccess(article -> log.debug("Flags of article {} set to read={}, favorite={}",
                        articleId, article.getRead(), article.getFavorite()));
    }
}
