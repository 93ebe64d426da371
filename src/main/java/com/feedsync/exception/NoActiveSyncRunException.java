package com.feedsync.exception;

public class NoActiveSyncRunException extends RuntimeException {

    public NoActiveSyncRunException(String feedId) {
        super("No active sync run for feed " + feedId);
    }
}
