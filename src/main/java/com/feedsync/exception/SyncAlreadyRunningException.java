package com.feedsync.exception;

public class SyncAlreadyRunningException extends RuntimeException {

    public SyncAlreadyRunningException(String feedId) {
        super("A sync run is already active for feed " + feedId);
    }
}
