package com.feedsync.dto;

import com.feedsync.model.Account;
import com.feedsync.model.SyncRun;
import com.feedsync.model.SyncStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSyncResult {
    private String feedId;
    private String accountName;
    private Long runId;
    /** Null when the run could not be started at all. */
    private SyncStatus status;
    private int newCount;
    private int updatedCount;
    private int unchangedCount;
    private String error;

    public static AccountSyncResult from(Account account, SyncRun run) {
        return AccountSyncResult.builder()
                .feedId(account.getFeedId())
                .accountName(account.getName())
                .runId(run.getId())
                .status(run.getStatus())
                .newCount(run.getArticlesNew())
                .updatedCount(run.getArticlesUpdated())
                .unchangedCount(run.getArticlesUnchanged())
                .error(run.getErrorMessage())
                .build();
    }

    public static AccountSyncResult notStarted(Account account, Throwable error) {
        return AccountSyncResult.builder()
                .feedId(account.getFeedId())
                .accountName(account.getName())
                .error(error.getMessage())
                .build();
    }
}
