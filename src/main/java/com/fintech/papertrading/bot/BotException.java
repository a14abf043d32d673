package com.fintech.papertrading.bot;

/**
 * Rejected bot lifecycle request.
 */
public class BotException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        CONFLICT,
        INVALID_REQUEST
    }

    private final Reason reason;

    public BotException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
