package com.fintech.papertrading.api.dto;

import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.domain.Transaction;

import java.util.List;
import java.util.Map;

/**
 * Balances, total value in the reference currency and full transaction history.
 */
public record PortfolioResponse(
    String userId,
    String username,
    Map<String, Double> balances,
    double totalValue,
    List<Transaction> transactions
) {

    public static PortfolioResponse of(String userId, Account account, double totalValue) {
        return new PortfolioResponse(userId, account.getUsername(), account.getBalances(), totalValue,
            account.getHistory());
    }
}
