package com.fintech.papertrading.ledger;

/**
 * Reasons a ledger action is rejected. A rejected action never mutates state.
 */
public enum TradeError {
    INVALID_QUANTITY("Quantity must be a positive number"),
    INSUFFICIENT_FUNDS("Insufficient quote balance for this purchase"),
    INSUFFICIENT_ASSETS("Insufficient base balance for this sale"),
    PRICE_UNAVAILABLE("No price available for this pair yet"),
    USER_NOT_FOUND("User not found"),
    DEPOSIT_TOO_SMALL("Deposit is below the minimum amount"),
    DEPOSIT_TOO_LARGE("Deposit exceeds the maximum amount"),
    WITHDRAWAL_EXCEEDS_BALANCE("Withdrawal exceeds the available balance");

    private final String description;

    TradeError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
