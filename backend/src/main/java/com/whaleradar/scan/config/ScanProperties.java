package com.whaleradar.scan.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Scan loop settings: cadence, lookback windows, notification cap, concurrency and upstream health thresholds.
 */
@ConfigurationProperties(prefix = "whaleradar.scan")
@NoArgsConstructor
@Getter
@Setter
public class ScanProperties {

    /** Delay between the end of one cycle and the start of the next. */
    private long pollIntervalMs = 30_000;

    /** Delay before the first cycle after startup. */
    private long initialDelayMs = 5_000;

    /** First-use lookback for ordinary addresses. */
    private int lookbackMinutes = 10;

    /** First-use lookback for elevated addresses (and for operator cursor resets). */
    private int elevatedLookbackHours = 48;

    /** More fresh findings than this for one address are sent as a single summary. */
    private int notificationCap = 20;

    /** Concurrent address iterations per cycle; 1 = sequential. */
    private int addressWorkers = 1;

    /** Upper bound for both fetches of one address, retries included. */
    private long fetchTimeoutMs = 45_000;

    private long statusReportIntervalMs = 7_200_000;

    private int largeTradeRetentionDays = 7;

    private long housekeepingIntervalMs = 3_600_000;

    /** Failure ratio above which upstream is reported degraded. */
    private double upstreamFailureRatio = 0.30;

    /** Calls that must be observed (more than this many) before the ratio is judged. */
    private int upstreamFailureMinCalls = 10;

    /** Number of most recent upstream calls the ratio is computed over. */
    private int upstreamWindowSize = 50;

    public long lookbackMs(boolean elevated) {
        return elevated ? elevatedLookbackHours * 3_600_000L : lookbackMinutes * 60_000L;
    }
}
