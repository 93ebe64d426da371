package com.feedsync.dto;

import com.feedsync.model.SyncStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncSummary {
    private int totalAccounts;
    private int succeeded;
    private int partial;
    private int failed;
    private int notStarted;
    private int totalNew;
    private int totalUpdated;
    private int totalUnchanged;
    private List<AccountSyncResult> results;

    public static SyncSummary of(List<AccountSyncResult> results) {
        SyncSummaryBuilder builder = SyncSummary.builder()
                .totalAccounts(results.size())
                .results(List.copyOf(results));
        int succeeded = 0;
        int partial = 0;
        int failed = 0;
        int notStarted = 0;
        int totalNew = 0;
        int totalUpdated = 0;
        int totalUnchanged = 0;
        for (AccountSyncResult result : results) {
            if (result.getStatus() == null) {
                notStarted++;
                continue;
            }
            if (result.getStatus() == SyncStatus.SUCCESS) {
                succeeded++;
            } else if (result.getStatus() == SyncStatus.PARTIAL) {
                partial++;
            } else {
                failed++;
            }
            totalNew += result.getNewCount();
            totalUpdated += result.getUpdatedCount();
            totalUnchanged += result.getUnchangedCount();
        }
        return builder.succeeded(succeeded)
                .partial(partial)
                .failed(failed)
                .notStarted(notStarted)
                .totalNew(totalNew)
                .totalUpdated(totalUpdated)
                .totalUnchanged(totalUnchanged)
                .build();
    }
}
