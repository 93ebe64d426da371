package com.feedsync.service.merge;

public enum MergeDecision {
    INSERTED,
    UPDATED,
    UNCHANGED
}
