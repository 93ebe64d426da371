package com.feedsync.service.sync;

import com.feedsync.config.SyncProperties;
import com.feedsync.dto.AccountSyncResult;
import com.feedsync.dto.SyncSummary;
import com.feedsync.exception.AccountNotFoundException;
import com.feedsync.exception.SyncCancelledException;
import com.feedsync.model.Account;
import com.feedsync.model.SyncMode;
import com.feedsync.model.SyncRun;
import com.feedsync.model.SyncTrigger;
import com.feedsync.repository.AccountRepository;
import com.feedsync.service.content.ContentNormalizer;
import com.feedsync.service.content.NormalizedArticle;
import com.feedsync.service.feed.FeedClient;
import com.feedsync.service.merge.ArticleMergeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives sync runs. Each account's pages are fetched strictly in order; several accounts may run
 * side by side, bounded by the configured worker pool size.
 * <p>
 * A run always ends in a terminal status: fetch failures, merge conflicts and cancellation are
 * folded into the run record instead of propagating to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncOrchestrator {

    private final AccountRepository accountRepository;
    private final FeedClient feedClient;
    private final ContentNormalizer contentNormalizer;
    private final ArticleMergeService mergeService;
    private final SyncRunService syncRunService;
    private final ActiveRunRegistry activeRuns;
    private final SyncProperties properties;

    public Mono<SyncRun> syncAccount(String feedId, SyncMode mode, SyncTrigger trigger) {
        return accountRepository.findByFeedId(feedId)
                .switchIfEmpty(Mono.error(() -> new AccountNotFoundException(feedId)))
                .flatMap(account -> run(account, mode, trigger));
    }

    /**
     * Syncs every active account. One account's failure is recorded in its result and never stops
     * the others.
     */
    public Mono<SyncSummary> syncAll(SyncMode mode) {
        log.info("Starting {} sync for all active accounts", mode);
        return accountRepository.findAllActive()
                .flatMap(account -> run(account, mode, SyncTrigger.SYNC_ALL)
                                .map(run -> AccountSyncResult.from(account, run))
                                .onErrorResume(error -> {
                                    log.warn("Sync for {} not started: {}", account.getFeedId(), error.getMessage());
                                    return Mono.just(AccountSyncResult.notStarted(account, error));
                                }),
                        properties.getWorkerPoolSize())
                .collectList()
                .map(SyncSummary::of)
                .doOnSuccess(summary -> log.info(
                        "Sync all completed: {} accounts, {} succeeded, {} partial, {} failed, {} new, {} updated",
                        summary.getTotalAccounts(), summary.getSucceeded(), summary.getPartial(),
                        summary.getFailed(), summary.getTotalNew(), summary.getTotalUpdated()));
    }

    /**
     * Requests cooperative cancellation; the run stops before its next page.
     *
     * @return false if no run is active for the feed
     */
    public boolean cancel(String feedId) {
        boolean signalled = activeRuns.cancel(feedId);
        if (signalled) {
            log.info("Cancellation requested for {}", feedId);
        }
        return signalled;
    }

    public Mono<SyncRun> run(Account account, SyncMode mode, SyncTrigger trigger) {
        return Mono.defer(() -> {
            SyncCancellation cancellation = activeRuns.register(account.getFeedId());
            return syncRunService.start(account, mode, trigger)
                    .flatMap(run -> execute(account, run, cancellation))
                    .doFinally(signal -> activeRuns.release(account.getFeedId(), cancellation));
        });
    }

    private Mono<SyncRun> execute(Account account, SyncRun run, SyncCancellation cancellation) {
        AtomicReference<SyncProgress> latest = new AtomicReference<>(SyncProgress.start(run.getMode()));
        AtomicBoolean finished = new AtomicBoolean();

        return Mono.just(latest.get())
                .expand(progress -> progress.isStopped()
                        ? Mono.empty()
                        : nextPage(account, progress, cancellation))
                .doOnNext(latest::set)
                .then()
                .onErrorResume(error -> {
                    latest.set(latest.get().stoppedBy(error));
                    return Mono.empty();
                })
                .then(Mono.defer(() -> finish(run, latest.get(), finished)))
                .doOnCancel(() -> {
                    log.warn("Sync run {} for {} abandoned by its subscriber", run.getId(), account.getFeedId());
                    finish(run, latest.get().stoppedBy(new SyncCancelledException(account.getFeedId())), finished);
                });
    }

    /**
     * Fetches, normalizes and merges the page at {@code progress.nextCursor()}. Failures end the
     * loop by returning a stopped progress rather than an error.
     */
    private Mono<SyncProgress> nextPage(Account account, SyncProgress progress, SyncCancellation cancellation) {
        return cancellation.check()
                .then(Mono.defer(() -> feedClient.fetchPage(account, progress.nextCursor(), cancellation)))
                .flatMap(page -> {
                    List<NormalizedArticle> records = page.items().stream()
                            .map(item -> contentNormalizer.normalize(item, account))
                            .toList();
                    return mergeService.merge(account, records)
                            .map(outcome -> progress.afterPage(page, outcome, properties.getMaxPages()));
                })
                .doOnNext(next -> {
                    if (next.stopReason() == StopReason.PAGE_CAP) {
                        log.warn("Feed {} hit the {}-page cap; remaining pages left for a later run",
                                account.getFeedId(), properties.getMaxPages());
                    }
                })
                .onErrorResume(error -> {
                    if (!(error instanceof SyncCancelledException)) {
                        log.warn("Paging stopped for {} at {}: {}", account.getFeedId(), progress.nextCursor(),
                                error.getMessage());
                    }
                    return Mono.just(progress.stoppedBy(error));
                });
    }

    private Mono<SyncRun> finish(SyncRun run, SyncProgress progress, AtomicBoolean finished) {
        if (!finished.compareAndSet(false, true)) {
            return Mono.empty();
        }
        // the terminal write runs in its own subscription; a subscriber leaving mid-save cannot cancel it
        Mono<SyncRun> save = syncRunService.complete(run, progress).cache();
        save.subscribe(
                saved -> { },
                error -> log.debug("Terminal save of sync run {} failed: {}", run.getId(), error.getMessage()));
        return save;
    }
}
