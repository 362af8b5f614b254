package com.whaleradar.api.controller;

import com.whaleradar.api.dto.StatusResponse;
import com.whaleradar.detection.config.ClusterProperties;
import com.whaleradar.ingestion.config.ClassifierProperties;
import com.whaleradar.scan.config.ScanProperties;
import com.whaleradar.scan.health.ScanStats;
import com.whaleradar.watchlist.WatchlistManager;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/status: JSON snapshot of scan counters and effective configuration.
 */
@RestController
@RequestMapping("/api/v1/status")
@RequiredArgsConstructor
public class StatusController {

    private final ScanStats scanStats;
    private final WatchlistManager watchlistManager;
    private final ScanProperties scanProperties;
    private final ClassifierProperties classifierProperties;
    private final ClusterProperties clusterProperties;

    @GetMapping
    public StatusResponse status() {
        ScanStats.Snapshot s = scanStats.snapshot();
        StatusResponse.Thresholds thresholds = new StatusResponse.Thresholds(
                scanProperties.getPollIntervalMs(),
                scanProperties.getLookbackMinutes(),
                scanProperties.getElevatedLookbackHours(),
                classifierProperties.getShortThresholdUsd(),
                classifierProperties.getDepositThresholdUsd(),
                clusterProperties.isEnabled(),
                clusterProperties.getWindowMinutes(),
                clusterProperties.getMinScore(),
                clusterProperties.getMinNotionalUsd(),
                clusterProperties.getMarketMinTradeSizeUsd());
        return new StatusResponse(
                s.startedAt(),
                s.cyclesCompleted(),
                s.clusterScansCompleted(),
                s.addressesScanned(),
                s.addressFailures(),
                s.upstreamCallsOk(),
                s.upstreamCallsFailed(),
                s.upstreamStatus().name(),
                s.lastUpstreamSuccess(),
                s.lastCycleCompletedAt(),
                s.alertsSent(),
                s.clustersDetected(),
                s.walletsElevated(),
                watchlistManager.watchedAddresses().size(),
                watchlistManager.elevatedAddresses().size(),
                thresholds);
    }
}
