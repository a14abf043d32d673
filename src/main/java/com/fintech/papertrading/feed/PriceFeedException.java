package com.fintech.papertrading.feed;

/**
 * Raised when the price feed cannot be reached or its response cannot be parsed.
 */
public class PriceFeedException extends RuntimeException {

    public PriceFeedException(String message) {
        super(message);
    }

    public PriceFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
