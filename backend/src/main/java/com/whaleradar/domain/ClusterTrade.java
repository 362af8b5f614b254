package com.whaleradar.domain;

import java.math.BigDecimal;

/**
 * Contributing trade embedded in a {@link TradeCluster}.
 */
public record ClusterTrade(
        String tradeId,
        String walletAddress,
        String instrument,
        TradeSide side,
        BigDecimal notional,
        long timestampMs
) {

    public static ClusterTrade from(LargeTrade trade) {
        return new ClusterTrade(trade.getId(), trade.getWalletAddress(), trade.getInstrument(),
                trade.getSide(), trade.getNotional(), trade.getTimestampMs());
    }
}
