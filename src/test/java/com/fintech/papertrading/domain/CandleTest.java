package com.fintech.papertrading.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Candle Tests")
class CandleTest {

    @Test
    @DisplayName("of() should create candle with single price")
    void testOfFactoryMethod() {
        Candle candle = Candle.of("BTC", 60_000L, 100.0);

        assertThat(candle.asset()).isEqualTo("BTC");
        assertThat(candle.time()).isEqualTo(60_000L);
        assertThat(candle.open()).isEqualTo(100.0);
        assertThat(candle.high()).isEqualTo(100.0);
        assertThat(candle.low()).isEqualTo(100.0);
        assertThat(candle.close()).isEqualTo(100.0);
        assertThat(candle.ticks()).isEqualTo(1L);
    }

    @ParameterizedTest(name = "high={0} < low={1} should throw exception")
    @CsvSource({
        "99.0, 100.0",
        "0.0, 0.1"
    })
    @DisplayName("Constructor should reject high < low")
    void testHighLessThanLow(double high, double low) {
        assertThatThrownBy(() -> new Candle("BTC", 1000L, 100.0, high, low, 100.0, 1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be less than low price");
    }

    @ParameterizedTest(name = "high={0}, open={1}, close={2} should throw exception")
    @MethodSource("invalidHighProvider")
    @DisplayName("Constructor should reject high < open or high < close")
    void testHighLessThanOpenOrClose(double high, double open, double close) {
        assertThatThrownBy(() -> new Candle("BTC", 1000L, open, high, 90.0, close, 1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be >=");
    }

    static Stream<Arguments> invalidHighProvider() {
        return Stream.of(
            Arguments.of(99.0, 100.0, 95.0),
            Arguments.of(99.0, 95.0, 100.0)
        );
    }

    @Test
    @DisplayName("Constructor should reject low > open")
    void testLowGreaterThanOpen() {
        assertThatThrownBy(() -> new Candle("BTC", 1000L, 100.0, 110.0, 101.0, 105.0, 1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be <=");
    }
}
