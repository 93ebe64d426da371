package com.feedsync.service.sync;

import com.feedsync.exception.AccountNotFoundException;
import com.feedsync.model.Account;
import com.feedsync.model.SyncMode;
import com.feedsync.model.SyncRun;
import com.feedsync.model.SyncStatus;
import com.feedsync.model.SyncTrigger;
import com.feedsync.repository.AccountRepository;
import com.feedsync.repository.SyncRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Persists the sync run audit log. Rows are written once at start and once at completion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncRunService {

    static final String INTERRUPTED_MESSAGE = "interrupted: process stopped while the run was active";

    private final SyncRunRepository syncRunRepository;
    private final AccountRepository accountRepository;

    public Mono<SyncRun> start(Account account, SyncMode mode, SyncTrigger trigger) {
        SyncRun run = SyncRun.builder()
                .accountId(account.getId())
                .mode(mode)
                .trigger(trigger)
                .status(SyncStatus.RUNNING)
                .startedAt(LocalDateTime.now())
                .build();
        return syncRunRepository.save(run)
                .doOnSuccess(saved -> log.info("Sync run {} started for {} (mode: {}, trigger: {})",
                        saved.getId(), account.getFeedId(), mode, trigger))
                .doOnError(error -> log.error("Could not record sync start for {}: {}",
                        account.getFeedId(), error.getMessage()));
    }

    public Mono<SyncRun> complete(SyncRun run, SyncProgress progress) {
        run.setPagesFetched(progress.pagesFetched());
        run.setArticlesFetched(progress.itemsFetched());
        run.setArticlesNew(progress.totals().newCount());
        run.setArticlesUpdated(progress.totals().updatedCount());
        run.setArticlesUnchanged(progress.totals().unchangedCount());
        run.setErrorMessage(progress.errorDetail());
        run.finish(progress.status(), LocalDateTime.now());

        return syncRunRepository.save(run)
                .doOnSuccess(saved -> logOutcome(saved, progress))
                .doOnError(error -> log.error("Could not record completion of sync run {}: {}",
                        run.getId(), error.getMessage()));
    }

    public Flux<SyncRun> recentRuns(String feedId, int limit) {
        if (feedId == null || feedId.isBlank()) {
            return syncRunRepository.findRecent(limit);
        }
        return accountRepository.findByFeedId(feedId)
                .switchIfEmpty(Mono.error(() -> new AccountNotFoundException(feedId)))
                .flatMapMany(account -> syncRunRepository.findRecentByAccountId(account.getId(), limit));
    }

    /**
     * Runs left RUNNING by a previous process can never finish; close them as failed.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedRuns() {
        syncRunRepository.failRunningRuns(INTERRUPTED_MESSAGE, LocalDateTime.now())
                .subscribe(
                        count -> {
                            if (count > 0) {
                                log.warn("Marked {} interrupted sync run(s) as failed", count);
                            }
                        },
                        error -> log.error("Could not recover interrupted sync runs: {}", error.getMessage(), error)
                );
    }

    private void logOutcome(SyncRun run, SyncProgress progress) {
        String counts = String.format("%d fetched, %d new, %d updated, %d unchanged over %d page(s)",
                run.getArticlesFetched(), run.getArticlesNew(), run.getArticlesUpdated(),
                run.getArticlesUnchanged(), run.getPagesFetched());
        switch (run.getStatus()) {
            case SUCCESS -> log.info("Sync run {} succeeded ({}): {}", run.getId(), progress.stopReason(), counts);
            case PARTIAL -> log.warn("Sync run {} partial: {} - {}", run.getId(), counts, run.getErrorMessage());
            default -> log.error("Sync run {} failed: {} - {}", run.getId(), counts, run.getErrorMessage());
        }
    }
}
