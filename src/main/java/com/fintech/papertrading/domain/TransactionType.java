package com.fintech.papertrading.domain;

public enum TransactionType {
    TRADE,
    DEPOSIT,
    WITHDRAWAL
}
