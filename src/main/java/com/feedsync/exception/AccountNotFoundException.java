package com.feedsync.exception;

public class AccountNotFoundException extends RuntimeException {

    public AccountNotFoundException(String feedId) {
        super("Account not found: " + feedId);
    }
}
