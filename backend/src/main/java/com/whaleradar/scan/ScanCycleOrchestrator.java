package com.whaleradar.scan;

import com.whaleradar.config.AsyncConfig;
import com.whaleradar.detection.ClusterScanService;
import com.whaleradar.domain.TradeCluster;
import com.whaleradar.ingestion.adapter.LedgerFetchException;
import com.whaleradar.ingestion.store.EventStore;
import com.whaleradar.notification.Notifier;
import com.whaleradar.scan.config.ScanProperties;
import com.whaleradar.scan.health.ScanStats;
import com.whaleradar.watchlist.WatchlistManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Drives one scan cycle: every watched address on the scan executor, then, strictly after all of them
 * finished, the cluster pass. New clusters are notified and their wallets promoted to elevated.
 * A failure in one address never affects the others or the cluster pass.
 */
@Service
@Slf4j
public class ScanCycleOrchestrator {

    static final String PROMOTION_REASON = "Cluster %s (score: %d)";

    private final AddressScanner addressScanner;
    private final ClusterScanService clusterScanService;
    private final WatchlistManager watchlistManager;
    private final EventStore eventStore;
    private final Notifier notifier;
    private final ScanStats stats;
    private final ScanProperties properties;
    private final Clock clock;
    private final Executor scanExecutor;

    public ScanCycleOrchestrator(AddressScanner addressScanner,
                                 ClusterScanService clusterScanService,
                                 WatchlistManager watchlistManager,
                                 EventStore eventStore,
                                 Notifier notifier,
                                 ScanStats stats,
                                 ScanProperties properties,
                                 Clock clock,
                                 @Qualifier(AsyncConfig.SCAN_EXECUTOR) Executor scanExecutor) {
        this.addressScanner = addressScanner;
        this.clusterScanService = clusterScanService;
        this.watchlistManager = watchlistManager;
        this.eventStore = eventStore;
        this.notifier = notifier;
        this.stats = stats;
        this.properties = properties;
        this.clock = clock;
        this.scanExecutor = scanExecutor;
    }

    public ScanCycleReport runCycle() {
        long cycleStartMs = clock.millis();
        List<String> addresses = watchlistManager.watchedAddresses();
        if (addresses.isEmpty()) {
            log.info("No watched addresses; address pass skipped");
        }
        List<CompletableFuture<AddressScanResult>> futures = addresses.stream()
                .map(address -> CompletableFuture.supplyAsync(() -> scanSafely(address, cycleStartMs), scanExecutor))
                .collect(Collectors.toList());
        List<AddressScanResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        ClusterPassResult clusterPass = runClusterPass();
        stats.cycleCompleted();
        ScanCycleReport report = new ScanCycleReport(cycleStartMs, results, clusterPass.clusters(), clusterPass.elevated());
        log.info("Scan cycle done in {} ms: {} addresses ({} failed), {} new findings, {} new clusters",
                clock.millis() - cycleStartMs, results.size(), report.failedAddresses(), report.freshFindings(),
                report.newClusters());
        return report;
    }

    /**
     * Cluster detection over the large-trade archive, then notification and promotion per new cluster.
     */
    ClusterPassResult runClusterPass() {
        List<TradeCluster> clusters;
        try {
            clusters = clusterScanService.scan();
        } catch (RuntimeException e) {
            log.warn("Cluster scan failed: {}", e.getMessage(), e);
            return new ClusterPassResult(0, 0);
        }
        int elevated = 0;
        for (TradeCluster cluster : clusters) {
            stats.clusterDetected();
            if (notifier.notifyCluster(cluster)) {
                stats.alertSent();
            }
            String reason = String.format(PROMOTION_REASON, cluster.shortId(), cluster.getScore());
            try {
                List<String> promoted = watchlistManager.promote(cluster.getWallets(), reason);
                elevated += promoted.size();
                stats.walletsElevated(promoted.size());
            } catch (DataAccessException e) {
                log.warn("Promotion for cluster {} failed: {}", cluster.shortId(), e.getMessage());
            }
        }
        stats.clusterScanCompleted();
        return new ClusterPassResult(clusters.size(), elevated);
    }

    /**
     * Operator action: rewinds a watched address's cursor to now minus its lookback so the next cycle
     * re-examines that window. Empty when the address is not watched.
     */
    public OptionalLong resetCursor(String address) {
        if (!watchlistManager.isWatched(address)) {
            return OptionalLong.empty();
        }
        String normalized = address.strip().toLowerCase(Locale.ROOT);
        long cursorMs = clock.millis() - properties.lookbackMs(watchlistManager.isElevated(normalized));
        eventStore.resetCursor(EventStore.cursorKey(normalized), cursorMs);
        return OptionalLong.of(cursorMs);
    }

    private AddressScanResult scanSafely(String address, long cycleStartMs) {
        try {
            AddressScanResult result = addressScanner.scan(address, cycleStartMs);
            stats.addressScanned();
            if (result.notified()) {
                stats.alertSent();
            }
            return result;
        } catch (LedgerFetchException e) {
            stats.addressFailed();
            log.warn("Fetch failed for {}, retrying next cycle: {}", address, e.getMessage());
            return AddressScanResult.failed(address, e.getMessage());
        } catch (DataAccessException e) {
            stats.addressFailed();
            log.warn("Store error while scanning {}: {}", address, e.getMessage());
            return AddressScanResult.failed(address, e.getMessage());
        } catch (RuntimeException e) {
            stats.addressFailed();
            log.error("Unexpected error while scanning {}", address, e);
            return AddressScanResult.failed(address, String.valueOf(e.getMessage()));
        }
    }

    record ClusterPassResult(int clusters, int elevated) {
    }
}
