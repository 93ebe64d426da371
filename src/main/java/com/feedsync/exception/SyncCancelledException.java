package com.feedsync.exception;

/**
 * Cooperative stop signal for a run. Caught by the orchestrator and recorded as a partial run.
 */
public class SyncCancelledException extends RuntimeException {

    public SyncCancelledException(String feedId) {
        super("Sync cancelled for feed " + feedId, null, false, false);
    }
}
