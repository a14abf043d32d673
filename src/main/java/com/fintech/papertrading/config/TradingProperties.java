package com.fintech.papertrading.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration for the paper trading service.
 * Maps to 'trading.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    private String referenceCurrency = "USD";
    private String demoUserId = "demo_user";
    private String demoUsername = "Demo User";
    private double startingBalance = 10_000.0;

    private MarketData marketData = new MarketData();
    private Ingestion ingestion = new Ingestion();
    private Ledger ledger = new Ledger();
    private Bot bot = new Bot();
    private Feed feed = new Feed();
    private Persistence persistence = new Persistence();

    @Data
    public static class MarketData {
        private int rawTickCapacity = 17_280;          // 24h at 5s
        private int fiveMinutePriceCapacity = 288;     // 24h at 5m
        private int oneMinuteCandleCapacity = 60;      // 1h
        private int fiveMinuteCandleCapacity = 288;    // 24h
    }

    @Data
    public static class Ingestion {
        private boolean enabled = true;
        private List<String> assets = List.of("BTC", "ETH");
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration backfillRange = Duration.ofHours(1);
        private int syntheticPoints = 720;
        // Used to seed the synthetic series when even the spot price cannot be fetched
        private Map<String, Double> seedPrices = new LinkedHashMap<>(Map.of(
            "BTC", 42_500.0,
            "ETH", 2_250.0
        ));
    }

    @Data
    public static class Ledger {
        private double minDeposit = 10.0;
        private double maxDeposit = 100_000.0;
    }

    @Data
    public static class Bot {
        private Duration tickInterval = Duration.ofSeconds(60);
        private int contextWindow = 720;                // 1h of raw ticks
        private int schedulerThreads = 4;
    }

    @Data
    public static class Feed {
        private String spotBaseUrl = "https://api.coinbase.com/v2";
        private String exchangeBaseUrl = "https://api.exchange.coinbase.com";
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration responseTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Persistence {
        private boolean enabled = true;
    }
}
