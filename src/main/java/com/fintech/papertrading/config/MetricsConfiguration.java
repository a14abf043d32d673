package com.fintech.papertrading.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Common tags and timer percentiles for every meter.
 *
 * Trade execution is lock-bound and sub-millisecond; HTTP and feed calls are in the
 * tens to thousands of milliseconds, so the histogram buckets span both.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "paper-trading-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() == Meter.Type.TIMER) {
                        return DistributionStatisticConfig.builder()
                            .percentiles(0.5, 0.95, 0.99)
                            .percentilePrecision(2)
                            // Timer SLO boundaries are in nanoseconds
                            .serviceLevelObjectives(
                                100_000.0,          // 100 μs
                                1_000_000.0,        // 1 ms
                                10_000_000.0,       // 10 ms
                                100_000_000.0,      // 100 ms
                                1_000_000_000.0,    // 1 s
                                5_000_000_000.0     // 5 s
                            )
                            .percentilesHistogram(true)
                            .expiry(Duration.ofSeconds(60))
                            .bufferLength(3)
                            .build()
                            .merge(config);
                    }
                    return config;
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
