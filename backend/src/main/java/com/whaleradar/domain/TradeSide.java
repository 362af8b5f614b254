package com.whaleradar.domain;

import java.util.Locale;

/**
 * Binary trade direction. Upstream encodes sides as B/A, buy/sell, bid/ask or long/short;
 * anything else maps to UNKNOWN and is never treated as a short open.
 */
public enum TradeSide {
    BUY,
    SELL,
    UNKNOWN;

    public static TradeSide parse(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "b", "buy", "bid", "long" -> BUY;
            case "a", "s", "sell", "ask", "short" -> SELL;
            default -> UNKNOWN;
        };
    }
}
