package com.feedsync.exception;

import lombok.Getter;

/**
 * Store constraint violation that the update path could not resolve. Indicates a data
 * integrity problem; the run that hits it ends as failed.
 */
@Getter
public class MergeConflictException extends RuntimeException {

    private final Long accountId;
    private final String guid;

    public MergeConflictException(Long accountId, String guid, Throwable cause) {
        super("Unresolvable merge conflict for account " + accountId + ", guid " + guid, cause);
        this.accountId = accountId;
        this.guid = guid;
    }
}
