package com.feedsync.repository;

import com.feedsync.model.Article;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface ArticleRepository extends R2dbcRepository<Article, Long> {

    /**
     * Row-locking lookup used by the merge path so that a user flag change cannot interleave
     * with a content update of the same article.
     */
    @Query("SELECT * FROM articles WHERE account_id = :accountId AND guid = :guid FOR UPDATE")
    Mono<Article> findForUpdate(Long accountId, String guid);

    /**
     * Articles published in {@code [from, to)}. With {@code includeUndated} set, rows without a
     * publication date are listed too, after the dated ones.
     */
    @Query("SELECT * FROM articles WHERE (published_at >= :from AND published_at < :to) " +
            "OR (:includeUndated AND published_at IS NULL) " +
            "ORDER BY published_at DESC NULLS LAST, id DESC LIMIT :limit")
    Flux<Article> findPublishedBetween(LocalDateTime from, LocalDateTime to, boolean includeUndated, int limit);

    @Query("SELECT * FROM articles WHERE account_id = :accountId " +
            "AND ((published_at >= :from AND published_at < :to) OR (:includeUndated AND published_at IS NULL)) " +
            "ORDER BY published_at DESC NULLS LAST, id DESC LIMIT :limit")
    Flux<Article> findPublishedBetweenForAccount(Long accountId, LocalDateTime from, LocalDateTime to,
                                                 boolean includeUndated, int limit);

    @Modifying
    @Query("UPDATE articles SET is_read = :read, is_favorite = :favorite WHERE id = :id")
    Mono<Integer> updateFlags(Long id, boolean read, boolean favorite);
}
