package com.fintech.papertrading;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Paper Trading Service
 *
 * Live-market paper trading against an external price feed.
 *
 * Key Features:
 * - Per-asset price ingestion with backfill and synthetic fallback
 * - Bounded multi-resolution market data (raw ticks, 5-minute points, 1m/5m candles)
 * - Multi-asset ledger with deposit/withdrawal limits
 * - Supervised trading bots with a hard stoploss
 * - SMA/EMA/RSI indicators
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class PaperTradingApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperTradingApplication.class, args);
    }
}
