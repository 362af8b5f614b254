package com.whaleradar.api.dto;

import com.whaleradar.domain.TradeCluster;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record ClusterResponse(
        String id,
        String instrument,
        String direction,
        List<String> wallets,
        int walletCount,
        int tradeCount,
        BigDecimal totalNotional,
        double timeSpanMinutes,
        double alignment,
        int score,
        Instant firstTrade,
        Instant lastTrade,
        Instant createdAt
) {

    public static ClusterResponse from(TradeCluster c) {
        return new ClusterResponse(
                c.getId(),
                c.getInstrument(),
                c.getDirection() != null ? c.getDirection().name() : null,
                c.getWallets(),
                c.getWalletCount(),
                c.getTradeCount(),
                c.getTotalNotional(),
                c.getTimeSpanMinutes(),
                c.getAlignment(),
                c.getScore(),
                Instant.ofEpochMilli(c.getFirstTradeMs()),
                Instant.ofEpochMilli(c.getLastTradeMs()),
                c.getCreatedAt());
    }
}
