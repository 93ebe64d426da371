package com.feedsync.model;

public enum SyncStatus {
    RUNNING,
    SUCCESS,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
