package com.whaleradar.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Classified, alert-worthy event derived from one fill or transfer of one address.
 * Unit of de-duplication and notification.
 *
 * @param detail short human label, e.g. "DEPOSIT" or "SELL Open Short"
 */
public record Finding(
        FindingKind kind,
        String address,
        String token,
        BigDecimal notional,
        long timestampMs,
        String sourceId,
        String detail
) {

    /**
     * Aggregate stand-in for a batch too large to send one by one.
     * Timestamp is the newest in the batch; notional is the batch total.
     */
    public static Finding summaryOf(String address, List<Finding> batch) {
        BigDecimal total = batch.stream()
                .map(Finding::notional)
                .filter(n -> n != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        long latest = batch.stream().mapToLong(Finding::timestampMs).max().orElse(0L);
        return new Finding(FindingKind.BATCH_SUMMARY, address, "MULTIPLE", total, latest, "",
                batch.size() + " new events");
    }
}
