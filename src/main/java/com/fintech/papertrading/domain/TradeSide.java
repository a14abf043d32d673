package com.fintech.papertrading.domain;

public enum TradeSide {
    BUY,
    SELL
}
