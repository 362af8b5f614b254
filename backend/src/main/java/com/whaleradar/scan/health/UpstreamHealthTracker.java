package com.whaleradar.scan.health;

import com.whaleradar.ingestion.adapter.LedgerCallListener;
import com.whaleradar.notification.Notifier;
import com.whaleradar.notification.StatusKind;
import com.whaleradar.scan.config.ScanProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Rolling success/failure ratio of upstream ledger calls. Flips to DEGRADED once more than the minimum
 * number of calls is in the window and the failure ratio exceeds the threshold (one warning per episode);
 * flips back on the first success that brings the ratio under the threshold (one recovery message).
 */
@Component
@Slf4j
public class UpstreamHealthTracker implements LedgerCallListener {

    private final ScanStats stats;
    private final Notifier notifier;
    private final double failureRatioThreshold;
    private final int minCalls;
    private final int windowSize;
    private final Deque<Boolean> window = new ArrayDeque<>();

    public UpstreamHealthTracker(ScanStats stats, Notifier notifier, ScanProperties properties) {
        this.stats = stats;
        this.notifier = notifier;
        this.failureRatioThreshold = properties.getUpstreamFailureRatio();
        this.minCalls = properties.getUpstreamFailureMinCalls();
        this.windowSize = Math.max(properties.getUpstreamWindowSize(), properties.getUpstreamFailureMinCalls() + 1);
    }

    @Override
    public void onCallSucceeded(String requestType) {
        stats.upstreamCallSucceeded();
        boolean recovered;
        double successRate;
        synchronized (window) {
            record(true);
            successRate = successRate();
            recovered = stats.getUpstreamStatus() == UpstreamStatus.DEGRADED && failureRatio() <= failureRatioThreshold;
            if (recovered || stats.getUpstreamStatus() == UpstreamStatus.UNKNOWN) {
                stats.setUpstreamStatus(UpstreamStatus.HEALTHY);
            }
        }
        if (recovered) {
            log.info("Upstream recovered, success rate {}", percent(successRate));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("Success rate", percent(successRate));
            notifier.notifyStatus(StatusKind.UPSTREAM_RECOVERED, details);
        }
    }

    @Override
    public void onCallFailed(String requestType, Exception cause) {
        stats.upstreamCallFailed();
        boolean degraded;
        double successRate;
        synchronized (window) {
            record(false);
            successRate = successRate();
            degraded = stats.getUpstreamStatus() != UpstreamStatus.DEGRADED
                    && window.size() > minCalls
                    && failureRatio() > failureRatioThreshold;
            if (degraded) {
                stats.setUpstreamStatus(UpstreamStatus.DEGRADED);
            }
        }
        log.warn("Upstream {} call failed: {}", requestType, cause != null ? cause.getMessage() : "unknown");
        if (degraded) {
            log.warn("Upstream degraded, success rate {}", percent(successRate));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("Error", cause != null ? cause.getMessage() : "unknown");
            details.put("Success rate", percent(successRate));
            notifier.notifyStatus(StatusKind.UPSTREAM_DEGRADED, details);
        }
    }

    private void record(boolean success) {
        window.addLast(success);
        while (window.size() > windowSize) {
            window.removeFirst();
        }
    }

    private double failureRatio() {
        if (window.isEmpty()) {
            return 0.0;
        }
        long failures = window.stream().filter(ok -> !ok).count();
        return (double) failures / window.size();
    }

    private double successRate() {
        return window.isEmpty() ? 1.0 : 1.0 - failureRatio();
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100);
    }
}
