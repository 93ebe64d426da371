package com.feedsync.service.merge;

import com.feedsync.exception.MergeConflictException;
import com.feedsync.model.Account;
import com.feedsync.model.Article;
import com.feedsync.repository.ArticleRepository;
import com.feedsync.service.content.NormalizedArticle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Reconciles normalized records with stored articles by {@code (accountId, guid)}.
 * <p>
 * Each record is decided and written in its own transaction, with the existing row locked, so
 * readers never see a half-applied update. Absence from a fetch is never treated as deletion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleMergeService {

    private final ArticleRepository articleRepository;
    private final TransactionalOperator transactionalOperator;

    public Mono<MergeOutcome> merge(Account account, List<NormalizedArticle> records) {
        return Flux.fromIterable(records)
                .concatMap(record -> mergeOne(account, record))
                .reduce(MergeOutcome.empty(), MergeOutcome::record)
                .doOnSuccess(outcome -> log.debug("Merged {} records for {}: {} new, {} updated, {} unchanged",
                        records.size(), account.getFeedId(),
                        outcome.newCount(), outcome.updatedCount(), outcome.unchangedCount()));
    }

    Mono<MergeDecision> mergeOne(Account account, NormalizedArticle record) {
        return transactionalOperator.transactional(insertOrUpdate(account, record))
                .onErrorResume(DataIntegrityViolationException.class, duplicate -> {
                    // lost an insert race on the unique key: the row exists now, take the update path
                    log.debug("Duplicate insert of guid {} for {}, retrying as update", record.getGuid(), account.getFeedId());
                    return transactionalOperator.transactional(updateExisting(account, record, duplicate))
                            .onErrorMap(DataIntegrityViolationException.class,
                                    e -> new MergeConflictException(account.getId(), record.getGuid(), e));
                });
    }

    private Mono<MergeDecision> insertOrUpdate(Account account, NormalizedArticle record) {
        return articleRepository.findForUpdate(account.getId(), record.getGuid())
                .flatMap(existing -> applyIfChanged(existing, record))
                .switchIfEmpty(Mono.defer(() -> insert(account, record)));
    }

    private Mono<MergeDecision> updateExisting(Account account, NormalizedArticle record, Throwable cause) {
        return articleRepository.findForUpdate(account.getId(), record.getGuid())
                .switchIfEmpty(Mono.error(() -> new MergeConflictException(account.getId(), record.getGuid(), cause)))
                .flatMap(existing -> applyIfChanged(existing, record));
    }

    private Mono<MergeDecision> insert(Account account, NormalizedArticle record) {
        LocalDateTime now = LocalDateTime.now();
        Article article = Article.builder()
                .accountId(account.getId())
                .guid(record.getGuid())
                .read(false)
                .favorite(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
        copyMutableFields(record, article);

        return articleRepository.save(article)
                .doOnNext(saved -> log.debug("Inserted article {} '{}'", saved.getGuid(), abbreviate(saved.getTitle())))
                .thenReturn(MergeDecision.INSERTED);
    }

    private Mono<MergeDecision> applyIfChanged(Article existing, NormalizedArticle record) {
        if (!hasChanged(existing, record)) {
            return Mono.just(MergeDecision.UNCHANGED);
        }
        copyMutableFields(record, existing);
        existing.setUpdatedAt(LocalDateTime.now());

        return articleRepository.save(existing)
                .doOnNext(saved -> log.debug("Updated article {} '{}'", saved.getGuid(), abbreviate(saved.getTitle())))
                .thenReturn(MergeDecision.UPDATED);
    }

    /**
     * Content, summary, publish time, cover and image list decide whether a stored article is stale.
     */
    static boolean hasChanged(Article existing, NormalizedArticle record) {
        return !sameText(existing.getContent(), record.getContent())
                || !sameText(existing.getSummary(), record.getSummary())
                || !Objects.equals(existing.getPublishedAt(), record.getPublishedAt())
                || !sameText(existing.getCoverImage(), record.getCoverImage())
                || !Objects.equals(nullToEmpty(existing.getImageUrls()), nullToEmpty(record.getImageUrls()));
    }

    // never touches guid, user flags or createdAt
    private static void copyMutableFields(NormalizedArticle record, Article target) {
        target.setTitle(record.getTitle());
        target.setAuthor(record.getAuthor());
        target.setUrl(record.getUrl());
        target.setContentHtml(record.getContentHtml());
        target.setContent(record.getContent());
        target.setSummary(record.getSummary());
        target.setImageUrls(record.getImageUrls());
        target.setCoverImage(record.getCoverImage());
        target.setPublishedAt(record.getPublishedAt());
        target.setWordCount(record.getWordCount());
        target.setReadingTimeMinutes(record.getReadingTimeMinutes());
    }

    private static boolean sameText(String a, String b) {
        return Objects.equals(a == null ? "" : a, b == null ? "" : b);
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }

    private static String abbreviate(String title) {
        if (title == null || title.length() <= 50) {
            return title;
        }
        return title.substring(0, 50);
    }
}
