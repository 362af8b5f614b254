package com.whaleradar.scan.job;

import com.whaleradar.scan.ScanCycleOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * The scan loop: one full cycle, then the poll interval, then the next cycle. fixedDelay keeps cycles
 * from overlapping.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WatchlistScanJob {

    private final ScanCycleOrchestrator orchestrator;

    @Scheduled(
            fixedDelayString = "${whaleradar.scan.poll-interval-ms:30000}",
            initialDelayString = "${whaleradar.scan.initial-delay-ms:5000}")
    public void runScheduled() {
        try {
            orchestrator.runCycle();
        } catch (RuntimeException e) {
            log.error("Scan cycle aborted, next cycle runs after the poll interval", e);
        }
    }
}
