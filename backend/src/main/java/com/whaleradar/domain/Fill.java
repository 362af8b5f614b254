package com.whaleradar.domain;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * One trade execution as returned by the ledger fetcher. Size is kept as reported (may be signed);
 * notional is always |size| × price.
 *
 * @param direction upstream position label such as "Open Short" or "Close Long"; may be empty
 */
public record Fill(
        String instrument,
        BigDecimal size,
        BigDecimal price,
        TradeSide side,
        String direction,
        long timestampMs,
        String tradeId,
        String orderId
) {

    public BigDecimal notional() {
        BigDecimal s = size != null ? size.abs() : BigDecimal.ZERO;
        BigDecimal p = price != null ? price : BigDecimal.ZERO;
        return s.multiply(p);
    }

    /**
     * A sell, or a fill whose position label marks a short open.
     */
    public boolean isShortOpen() {
        if (side == TradeSide.SELL) {
            return true;
        }
        if (direction == null) {
            return false;
        }
        String label = direction.toLowerCase(Locale.ROOT);
        return (label.contains("open") && label.contains("short")) || label.contains("short_open");
    }
}
