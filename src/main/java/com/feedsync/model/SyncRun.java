package com.feedsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Audit record of one sync invocation for one account. Created as {@link SyncStatus#RUNNING}
 * and moved to a terminal status exactly once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("sync_runs")
public class SyncRun {
    @Id
    private Long id;

    @Column("account_id")
    private Long accountId;

    @Column("mode")
    private SyncMode mode;

    @Column("status")
    private SyncStatus status;

    @Column("trigger_source")
    private SyncTrigger trigger;

    @Column("pages_fetched")
    private int pagesFetched;

    @Column("articles_fetched")
    private int articlesFetched;

    @Column("articles_new")
    private int articlesNew;

    @Column("articles_updated")
    private int articlesUpdated;

    @Column("articles_unchanged")
    private int articlesUnchanged;

    @Column("error_message")
    private String errorMessage;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("completed_at")
    private LocalDateTime completedAt;

    @Column("duration_ms")
    private Long durationMs;

    public void finish(SyncStatus terminalStatus, LocalDateTime completedAt) {
        if (status != SyncStatus.RUNNING) {
            throw new IllegalStateException("Sync run " + id + " already finished with status " + status);
        }
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        this.status = terminalStatus;
        this.completedAt = completedAt;
        if (startedAt != null) {
            this.durationMs = Duration.between(startedAt, completedAt).toMillis();
        }
    }
}
