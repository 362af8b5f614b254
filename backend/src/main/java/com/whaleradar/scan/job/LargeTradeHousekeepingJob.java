package com.whaleradar.scan.job;

import com.whaleradar.ingestion.store.EventStore;
import com.whaleradar.scan.config.ScanProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Drops archived large trades older than the retention period; they can no longer fall into any
 * detection window. Seen digests are never pruned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LargeTradeHousekeepingJob {

    private final EventStore eventStore;
    private final ScanProperties properties;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${whaleradar.scan.housekeeping-interval-ms:3600000}",
            initialDelayString = "${whaleradar.scan.housekeeping-interval-ms:3600000}")
    public void runScheduled() {
        try {
            prune();
        } catch (DataAccessException e) {
            log.warn("Large trade housekeeping failed: {}", e.getMessage());
        }
    }

    public long prune() {
        long cutoffMs = clock.millis() - Math.max(1, properties.getLargeTradeRetentionDays()) * 86_400_000L;
        long removed = eventStore.pruneLargeTradesOlderThan(cutoffMs);
        if (removed > 0) {
            log.info("Pruned {} large trades older than {}", removed, cutoffMs);
        }
        return removed;
    }
}
