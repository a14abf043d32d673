package com.fintech.papertrading.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Immutable ledger entry. Trades, deposits and withdrawals share one shape;
 * deposits and withdrawals are recorded as reference-currency pairs at price 1.0.
 * The USD snapshots are analytics only and never take part in settlement.
 *
 * @param userId Owner of the account
 * @param type Trade, deposit or withdrawal
 * @param baseAsset Asset bought or sold
 * @param quoteAsset Asset used to price the base
 * @param side Buy or sell (deposits are BUY, withdrawals SELL)
 * @param quantity Quantity of base asset
 * @param price Base priced in quote units
 * @param timestamp Time the entry was appended
 * @param baseUsdPrice USD price of the base leg at execution, null when unavailable
 * @param quoteUsdPrice USD price of the quote leg at execution, null when unavailable
 * @param executedBy Strategy name for bot trades, null for manual actions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Transaction(
    String userId,
    TransactionType type,
    String baseAsset,
    String quoteAsset,
    TradeSide side,
    double quantity,
    double price,
    Instant timestamp,
    Double baseUsdPrice,
    Double quoteUsdPrice,
    String executedBy
) {

    /** Quote-currency value moved by this entry (price * quantity). */
    public double notional() {
        return price * quantity;
    }

    @JsonIgnore
    public boolean isBotTrade() {
        return executedBy != null;
    }
}
