package com.fintech.papertrading.ledger;

/**
 * Raised when an account is opened under a user id that is already taken.
 */
public class DuplicateAccountException extends RuntimeException {

    private final String userId;

    public DuplicateAccountException(String userId) {
        super("Account already exists: " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
