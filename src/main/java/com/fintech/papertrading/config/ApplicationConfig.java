package com.fintech.papertrading.config;

import com.fintech.papertrading.marketdata.MarketDataStore;
import com.fintech.papertrading.state.TradingState;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TradingState tradingState(TradingProperties properties) {
        TradingProperties.MarketData marketData = properties.getMarketData();
        MarketDataStore store = new MarketDataStore(
            properties.getReferenceCurrency(),
            new MarketDataStore.Capacities(
                marketData.getRawTickCapacity(),
                marketData.getFiveMinutePriceCapacity(),
                marketData.getOneMinuteCandleCapacity(),
                marketData.getFiveMinuteCandleCapacity()
            )
        );
        return new TradingState(store);
    }
}
