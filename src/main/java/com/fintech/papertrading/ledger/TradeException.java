package com.fintech.papertrading.ledger;

/**
 * Ledger rejection carrying a {@link TradeError}.
 */
public class TradeException extends RuntimeException {

    private final TradeError error;

    public TradeException(TradeError error) {
        this(error, error.description());
    }

    public TradeException(TradeError error, String message) {
        super(message);
        this.error = error;
    }

    public TradeError getError() {
        return error;
    }
}
