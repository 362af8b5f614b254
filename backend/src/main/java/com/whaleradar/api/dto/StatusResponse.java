package com.whaleradar.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * GET /api/v1/status body: scan counters, watchlist sizes and the effective thresholds.
 */
public record StatusResponse(
        Instant startedAt,
        long cyclesCompleted,
        long clusterScansCompleted,
        long addressesScanned,
        long addressFailures,
        long upstreamCallsOk,
        long upstreamCallsFailed,
        String upstreamStatus,
        Instant lastUpstreamSuccess,
        Instant lastCycleCompletedAt,
        long alertsSent,
        long clustersDetected,
        long walletsElevated,
        int watchedAddresses,
        int elevatedAddresses,
        Thresholds thresholds
) {

    public record Thresholds(
            long pollIntervalMs,
            int lookbackMinutes,
            int elevatedLookbackHours,
            BigDecimal shortThresholdUsd,
            BigDecimal depositThresholdUsd,
            boolean clusterDetectionEnabled,
            int clusterWindowMinutes,
            int clusterMinScore,
            BigDecimal clusterMinNotionalUsd,
            BigDecimal marketMinTradeSizeUsd
    ) {
    }
}
