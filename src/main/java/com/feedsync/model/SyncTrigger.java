package com.feedsync.model;

public enum SyncTrigger {
    API,
    REGISTRATION,
    SYNC_ALL
}
