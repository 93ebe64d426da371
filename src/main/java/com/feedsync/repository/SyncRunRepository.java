package com.feedsync.repository;

import com.feedsync.model.SyncRun;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface SyncRunRepository extends R2dbcRepository<SyncRun, Long> {

    @Query("SELECT * FROM sync_runs WHERE account_id = :accountId ORDER BY started_at DESC LIMIT :limit")
    Flux<SyncRun> findRecentByAccountId(Long accountId, int limit);

    @Query("SELECT * FROM sync_runs ORDER BY started_at DESC LIMIT :limit")
    Flux<SyncRun> findRecent(int limit);

    @Modifying
    @Query("UPDATE sync_runs SET status = 'FAILED', error_message = :errorMessage, completed_at = :completedAt " +
            "WHERE status = 'RUNNING'")
    Mono<Integer> failRunningRuns(String errorMessage, LocalDateTime completedAt);
}
