package com.feedsync.service.article;

import com.feedsync.dto.ArticleFlagsRequest;
import com.feedsync.exception.AccountNotFoundException;
import com.feedsync.exception.ArticleNotFoundException;
import com.feedsync.model.Account;
import com.feedsync.model.Article;
import com.feedsync.repository.AccountRepository;
import com.feedsync.repository.ArticleRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ArticleQueryServiceTest {

    private static final LocalDateTime FROM = LocalDateTime.of(2024, 5, 1, 0, 0);
    private static final LocalDateTime TO = LocalDateTime.of(2024, 5, 2, 0, 0);

    @Mock
    private ArticleRepository articleRepository;

    @Mock
    private AccountRepository accountRepository;

    @InjectMocks
    private ArticleQueryService articleQueryService;

    @Test
    void findArticles_shouldQueryAcrossAccountsWithoutFeedFilter() {
        Article article = Article.builder().id(1L).guid("g1").build();
        when(articleRepository.findPublishedBetween(FROM, TO, false, 50)).thenReturn(Flux.just(article));

        StepVerifier.create(articleQueryService.findArticles(null, FROM, TO, 50))
                .expectNext(article)
                .verifyComplete();

        verifyNoInteractions(accountRepository);
    }

    @Test
    void findArticles_shouldFilterByAccountAndClampLimit() {
        when(accountRepository.findByFeedId("feed-a")).thenReturn(Mono.just(Account.builder().id(9L).feedId("feed-a").build()));
        when(articleRepository.findPublishedBetweenForAccount(9L, FROM, TO, false, ArticleQueryService.MAX_LIMIT))
                .thenReturn(Flux.empty());

        StepVerifier.create(articleQueryService.findArticles("feed-a", FROM, TO, 1_000_000))
                .verifyComplete();
    }

    @Test
    void findArticles_shouldListUndatedArticlesWhenUnbounded() {
        Article dated = Article.builder().id(1L).guid("g1").publishedAt(FROM).build();
        Article undated = Article.builder().id(2L).guid("g2").build();
        when(accountRepository.findByFeedId("feed-a")).thenReturn(Mono.just(Account.builder().id(9L).feedId("feed-a").build()));
        when(articleRepository.findPublishedBetweenForAccount(eq(9L), any(), any(), eq(true), eq(100)))
                .thenReturn(Flux.just(dated, undated));

        StepVerifier.create(articleQueryService.findArticles("feed-a", null, null, 100))
                .expectNext(dated)
                .assertNext(article -> assertNull(article.getPublishedAt()))
                .verifyComplete();
    }

    @Test
    void findArticles_shouldLeaveUndatedArticlesOutOfDateRanges() {
        when(articleRepository.findPublishedBetween(eq(FROM), any(), eq(false), eq(10))).thenReturn(Flux.empty());

        StepVerifier.create(articleQueryService.findArticles(null, FROM, null, 10))
                .verifyComplete();

        verify(articleRepository, never()).findPublishedBetween(any(), any(), eq(true), anyInt());
    }

    @Test
    void findArticles_shouldRejectInvertedRange() {
        StepVerifier.create(articleQueryService.findArticles(null, TO, FROM, 10))
                .expectError(IllegalArgumentException.class)
                .verify();

        verifyNoInteractions(articleRepository);
    }

    @Test
    void findArticles_shouldFailForUnknownAccount() {
        when(accountRepository.findByFeedId("missing")).thenReturn(Mono.empty());

        StepVerifier.create(articleQueryService.findArticles("missing", null, null, 10))
                .expectError(AccountNotFoundException.class)
                .verify();
    }

    @Test
    void updateFlags_shouldKeepUnspecifiedFlags() {
        Article article = Article.builder().id(5L).guid("g1").read(true).favorite(false).build();
        when(articleRepository.findById(5L)).thenReturn(Mono.just(article));
        when(articleRepository.updateFlags(5L, true, true)).thenReturn(Mono.just(1));

        StepVerifier.create(articleQueryService.updateFlags(5L, ArticleFlagsRequest.builder().favorite(true).build()))
                .assertNext(updated -> {
                    assertTrue(updated.getRead());
                    assertTrue(updated.getFavorite());
                })
                .verifyComplete();
    }

    @Test
    void updateFlags_shouldFailForUnknownArticle() {
        when(articleRepository.findById(anyLong())).thenReturn(Mono.empty());

        StepVerifier.create(articleQueryService.updateFlags(5L, new ArticleFlagsRequest(true, null)))
                .expectError(ArticleNotFoundException.class)
                .verify();

        verify(articleRepository, never()).updateFlags(anyLong(), anyBoolean(), anyBoolean());
    }
}
