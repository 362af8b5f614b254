package com.whaleradar.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Detected coordinated-trading pattern. Created once by the cluster detector and never mutated:
 * no setters, and the store inserts it only if the id is new.
 * Id is derived from (first trade time, wallet count, instrument, direction).
 */
@Document(collection = "trade_clusters")
@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TradeCluster {

    @Id
    @EqualsAndHashCode.Include
    private final String id;
    private final List<String> wallets;
    private final String instrument;
    private final ClusterDirection direction;
    private final List<ClusterTrade> trades;
    private final BigDecimal totalNotional;
    private final int walletCount;
    private final int tradeCount;
    private final double timeSpanMinutes;
    private final double alignment;
    private final int score;
    private final long firstTradeMs;
    private final long lastTradeMs;
    @Indexed
    private final Instant createdAt;

    /** Short id used in log lines, promotion reasons and notifications. */
    public String shortId() {
        return id == null ? "" : id.substring(0, Math.min(8, id.length()));
    }
}
