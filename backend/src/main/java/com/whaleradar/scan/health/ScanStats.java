package com.whaleradar.scan.health;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory counters since process start. Reset on restart; exposed through the status endpoint and
 * the periodic status report.
 */
@Component
public class ScanStats {

    private final Clock clock;
    private final Instant startedAt;
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicLong clusterScansCompleted = new AtomicLong();
    private final AtomicLong addressesScanned = new AtomicLong();
    private final AtomicLong addressFailures = new AtomicLong();
    private final AtomicLong upstreamCallsOk = new AtomicLong();
    private final AtomicLong upstreamCallsFailed = new AtomicLong();
    private final AtomicLong alertsSent = new AtomicLong();
    private final AtomicLong clustersDetected = new AtomicLong();
    private final AtomicLong walletsElevated = new AtomicLong();
    private final AtomicReference<Instant> lastUpstreamSuccess = new AtomicReference<>();
    private final AtomicReference<Instant> lastCycleCompletedAt = new AtomicReference<>();
    private final AtomicReference<UpstreamStatus> upstreamStatus = new AtomicReference<>(UpstreamStatus.UNKNOWN);

    public ScanStats(Clock clock) {
        this.clock = clock;
        this.startedAt = Instant.now(clock);
    }

    public void cycleCompleted() {
        cyclesCompleted.incrementAndGet();
        lastCycleCompletedAt.set(Instant.now(clock));
    }

    public void clusterScanCompleted() {
        clusterScansCompleted.incrementAndGet();
    }

    public void addressScanned() {
        addressesScanned.incrementAndGet();
    }

    public void addressFailed() {
        addressFailures.incrementAndGet();
    }

    public void upstreamCallSucceeded() {
        upstreamCallsOk.incrementAndGet();
        lastUpstreamSuccess.set(Instant.now(clock));
    }

    public void upstreamCallFailed() {
        upstreamCallsFailed.incrementAndGet();
    }

    public void alertSent() {
        alertsSent.incrementAndGet();
    }

    public void clusterDetected() {
        clustersDetected.incrementAndGet();
    }

    public void walletsElevated(int count) {
        walletsElevated.addAndGet(count);
    }

    public void setUpstreamStatus(UpstreamStatus status) {
        upstreamStatus.set(status);
    }

    public UpstreamStatus getUpstreamStatus() {
        return upstreamStatus.get();
    }

    public Snapshot snapshot() {
        return new Snapshot(startedAt, cyclesCompleted.get(), clusterScansCompleted.get(), addressesScanned.get(),
                addressFailures.get(), upstreamCallsOk.get(), upstreamCallsFailed.get(), alertsSent.get(),
                clustersDetected.get(), walletsElevated.get(), lastUpstreamSuccess.get(), lastCycleCompletedAt.get(),
                upstreamStatus.get());
    }

    public record Snapshot(
            Instant startedAt,
            long cyclesCompleted,
            long clusterScansCompleted,
            long addressesScanned,
            long addressFailures,
            long upstreamCallsOk,
            long upstreamCallsFailed,
            long alertsSent,
            long clustersDetected,
            long walletsElevated,
            Instant lastUpstreamSuccess,
            Instant lastCycleCompletedAt,
            UpstreamStatus upstreamStatus
    ) {
    }
}
