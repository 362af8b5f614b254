package com.whaleradar.scan.job;

import com.whaleradar.detection.config.ClusterProperties;
import com.whaleradar.ingestion.config.ClassifierProperties;
import com.whaleradar.notification.Notifier;
import com.whaleradar.notification.StatusKind;
import com.whaleradar.scan.config.ScanProperties;
import com.whaleradar.scan.health.ScanStats;
import com.whaleradar.watchlist.WatchlistManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Startup message once the application is ready, then a periodic status report.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatusReportJob {

    private final Notifier notifier;
    private final ScanStats stats;
    private final WatchlistManager watchlistManager;
    private final ScanProperties scanProperties;
    private final ClassifierProperties classifierProperties;
    private final ClusterProperties clusterProperties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        Map<String, Object> details = startupDetails();
        log.info("Whale radar started: {}", details);
        notifier.notifyStatus(StatusKind.STARTUP, details);
    }

    @Scheduled(
            fixedRateString = "${whaleradar.scan.status-report-interval-ms:7200000}",
            initialDelayString = "${whaleradar.scan.status-report-interval-ms:7200000}")
    public void runScheduled() {
        try {
            notifier.notifyStatus(StatusKind.STATUS_REPORT, reportDetails());
        } catch (RuntimeException e) {
            log.warn("Status report failed: {}", e.getMessage(), e);
        }
    }

    Map<String, Object> startupDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("Watched addresses", watchlistManager.watchedAddresses().size());
        details.put("Elevated addresses", watchlistManager.elevatedAddresses().size());
        details.put("Poll interval", scanProperties.getPollIntervalMs() / 1000 + "s");
        details.put("Short threshold", usd(classifierProperties.getShortThresholdUsd()));
        details.put("Deposit threshold", usd(classifierProperties.getDepositThresholdUsd()));
        details.put("Cluster detection", clusterProperties.isEnabled() ? "enabled" : "disabled");
        return details;
    }

    Map<String, Object> reportDetails() {
        ScanStats.Snapshot s = stats.snapshot();
        Duration uptime = Duration.between(s.startedAt(), Instant.now(clock));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("Uptime", uptime.toHours() + "h " + uptime.toMinutesPart() + "m");
        details.put("Scan cycles", s.cyclesCompleted());
        details.put("Cluster scans", s.clusterScansCompleted());
        details.put("Upstream", s.upstreamStatus());
        details.put("API calls ok", s.upstreamCallsOk());
        details.put("API calls failed", s.upstreamCallsFailed());
        details.put("Alerts sent", s.alertsSent());
        details.put("Clusters detected", s.clustersDetected());
        details.put("Wallets elevated", s.walletsElevated());
        details.put("Cluster detection", clusterProperties.isEnabled() ? "enabled" : "disabled");
        return details;
    }

    private static String usd(BigDecimal amount) {
        return String.format(Locale.ROOT, "$%,.0f", amount);
    }
}
