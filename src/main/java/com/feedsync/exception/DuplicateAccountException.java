package com.feedsync.exception;

public class DuplicateAccountException extends RuntimeException {

    public DuplicateAccountException(String feedId) {
        super("Account already exists: " + feedId);
    }
}
