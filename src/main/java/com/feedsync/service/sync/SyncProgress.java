package com.feedsync.service.sync;

import com.feedsync.exception.FetchException;
import com.feedsync.exception.MergeConflictException;
import com.feedsync.exception.SyncCancelledException;
import com.feedsync.model.SyncMode;
import com.feedsync.model.SyncStatus;
import com.feedsync.service.feed.FeedCursor;
import com.feedsync.service.feed.FeedPage;
import com.feedsync.service.merge.MergeOutcome;

/**
 * Immutable paging state of one run. A run keeps fetching while {@link #stopReason()} is null.
 */
public record SyncProgress(SyncMode mode,
                           FeedCursor nextCursor,
                           int pagesFetched,
                           int itemsFetched,
                           MergeOutcome totals,
                           StopReason stopReason,
                           String errorDetail) {

    public static SyncProgress start(SyncMode mode) {
        return new SyncProgress(mode, FeedCursor.first(), 0, 0, MergeOutcome.empty(), null, null);
    }

    public boolean isStopped() {
        return stopReason != null;
    }

    public SyncProgress afterPage(FeedPage page, MergeOutcome outcome, int maxPages) {
        int pages = pagesFetched + 1;
        StopReason reason = null;
        if (mode == SyncMode.INCREMENTAL && outcome.isAllUnchanged()) {
            reason = StopReason.CAUGHT_UP;
        } else if (!page.hasMore() || page.isEmpty()) {
            reason = StopReason.EXHAUSTED;
        } else if (pages >= maxPages) {
            reason = StopReason.PAGE_CAP;
        }
        return new SyncProgress(mode, page.nextCursor(), pages, itemsFetched + page.items().size(),
                totals.plus(outcome), reason, null);
    }

    public SyncProgress stoppedBy(Throwable error) {
        StopReason reason;
        String detail;
        if (error instanceof SyncCancelledException) {
            reason = StopReason.CANCELLED;
            detail = "cancelled after " + pagesFetched + " page(s)";
        } else if (error instanceof FetchException) {
            reason = StopReason.FETCH_FAILED;
            detail = error.getMessage();
        } else if (error instanceof MergeConflictException) {
            reason = StopReason.MERGE_CONFLICT;
            detail = error.getMessage();
        } else {
            reason = StopReason.UNEXPECTED_ERROR;
            detail = error.getClass().getSimpleName() + ": " + error.getMessage();
        }
        return new SyncProgress(mode, nextCursor, pagesFetched, itemsFetched, totals, reason, detail);
    }

    public SyncStatus status() {
        if (stopReason == null) {
            return SyncStatus.RUNNING;
        }
        return switch (stopReason) {
            case EXHAUSTED, CAUGHT_UP, PAGE_CAP -> SyncStatus.SUCCESS;
            case CANCELLED -> SyncStatus.PARTIAL;
            case FETCH_FAILED -> pagesFetched > 0 ? SyncStatus.PARTIAL : SyncStatus.FAILED;
            case MERGE_CONFLICT, UNEXPECTED_ERROR -> SyncStatus.FAILED;
        };
    }
}
