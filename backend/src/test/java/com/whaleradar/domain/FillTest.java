package com.whaleradar.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class FillTest {

    @Test
    void notional_usesAbsoluteSize() {
        Fill fill = fill("-2.5", "40000", TradeSide.SELL, "");
        assertThat(fill.notional()).isEqualByComparingTo("100000");
    }

    @Test
    void notional_missingNumbersAreZero() {
        Fill fill = new Fill("BTC", null, new BigDecimal("100"), TradeSide.BUY, "", 1L, "t", "o");
        assertThat(fill.notional()).isEqualByComparingTo("0");
    }

    @Test
    void sell_isShortOpen() {
        assertThat(fill("1", "1", TradeSide.SELL, "Close Long").isShortOpen()).isTrue();
    }

    @Test
    void buyLabelledOpenShort_isShortOpen() {
        assertThat(fill("1", "1", TradeSide.UNKNOWN, "Open Short").isShortOpen()).isTrue();
        assertThat(fill("1", "1", TradeSide.UNKNOWN, "short_open").isShortOpen()).isTrue();
    }

    @Test
    void buyOpeningLong_isNotShortOpen() {
        assertThat(fill("1", "1", TradeSide.BUY, "Open Long").isShortOpen()).isFalse();
        assertThat(fill("1", "1", TradeSide.BUY, null).isShortOpen()).isFalse();
    }

    @Test
    void sideEncodings_normalise() {
        assertThat(TradeSide.parse("B")).isEqualTo(TradeSide.BUY);
        assertThat(TradeSide.parse("A")).isEqualTo(TradeSide.SELL);
        assertThat(TradeSide.parse("bid")).isEqualTo(TradeSide.BUY);
        assertThat(TradeSide.parse("Short")).isEqualTo(TradeSide.SELL);
        assertThat(TradeSide.parse("?")).isEqualTo(TradeSide.UNKNOWN);
        assertThat(TradeSide.parse(null)).isEqualTo(TradeSide.UNKNOWN);
    }

    private static Fill fill(String size, String price, TradeSide side, String direction) {
        return new Fill("BTC", new BigDecimal(size), new BigDecimal(price), side, direction, 1_700_000_000_000L, "t1", "o1");
    }
}
