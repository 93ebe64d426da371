package com.feedsync.service.sync;

public enum StopReason {
    /** Upstream reported no further pages. */
    EXHAUSTED,
    /** Incremental run reached a page of known, unchanged articles. */
    CAUGHT_UP,
    /** The configured page cap was reached. */
    PAGE_CAP,
    FETCH_FAILED,
    CANCELLED,
    MERGE_CONFLICT,
    UNEXPECTED_ERROR
}
