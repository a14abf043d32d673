package com.fintech.papertrading.marketdata;

import com.fintech.papertrading.domain.PriceTick;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BoundedSeries Tests")
class BoundedSeriesTest {

    private BoundedSeries<PriceTick> series;

    @BeforeEach
    void setUp() {
        series = new BoundedSeries<>(3, PriceTick::asset);
    }

    @Test
    @DisplayName("Appending past capacity evicts the oldest entry of that asset only")
    void testEvictionPerAsset() {
        series.append(new PriceTick(1, "BTC", 100));
        series.append(new PriceTick(1, "ETH", 10));
        series.append(new PriceTick(2, "BTC", 101));
        series.append(new PriceTick(3, "BTC", 102));

        Optional<PriceTick> evicted = series.append(new PriceTick(4, "BTC", 103));

        assertThat(evicted).map(PriceTick::price).contains(100.0);
        assertThat(series.size("BTC")).isEqualTo(3);
        assertThat(series.size("ETH")).isEqualTo(1);
        assertThat(series.last("BTC", 10)).extracting(PriceTick::price).containsExactly(101.0, 102.0, 103.0);
    }

    @Test
    @DisplayName("last() returns the newest entries oldest first")
    void testLastOrdering() {
        series.append(new PriceTick(1, "BTC", 100));
        series.append(new PriceTick(2, "BTC", 101));
        series.append(new PriceTick(3, "BTC", 102));

        assertThat(series.last("BTC", 2)).extracting(PriceTick::timestamp).containsExactly(2L, 3L);
        assertThat(series.latest("BTC")).map(PriceTick::price).contains(102.0);
    }

    @Test
    @DisplayName("Unknown assets and non-positive limits yield empty results, never errors")
    void testEmptyQueries() {
        assertThat(series.last("DOGE", 5)).isEmpty();
        assertThat(series.latest("DOGE")).isEmpty();
        assertThat(series.size("DOGE")).isZero();

        series.append(new PriceTick(1, "BTC", 100));
        assertThat(series.last("BTC", 0)).isEmpty();
    }
}
