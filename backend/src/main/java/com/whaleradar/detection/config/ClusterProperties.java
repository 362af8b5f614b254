package com.whaleradar.detection.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Cross-account cluster detection thresholds.
 */
@ConfigurationProperties(prefix = "whaleradar.cluster")
@NoArgsConstructor
@Getter
@Setter
public class ClusterProperties {

    private boolean enabled = true;

    /** Detection window in minutes; also the maximum time span of one cluster. */
    private int windowMinutes = 60;

    /** Minimum suspicion score (0..100) for a cluster to be reported. */
    private int minScore = 70;

    /** Minimum total notional of a cluster in USD. */
    private BigDecimal minNotionalUsd = new BigDecimal("50000000");

    /** Fills at or above this notional are archived and considered by the cluster scan. */
    private BigDecimal marketMinTradeSizeUsd = new BigDecimal("5000000");

    private int minTrades = 3;

    private int minWallets = 2;

    /** max(sells, buys) / trades must reach this ratio. */
    private double minAlignment = 0.80;

    /** Age used when an account's age cannot be resolved. */
    private long defaultWalletAgeDays = 30;
}
