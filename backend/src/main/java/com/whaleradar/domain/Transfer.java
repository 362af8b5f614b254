package com.whaleradar.domain;

import java.math.BigDecimal;

/**
 * One ledger movement (deposit, withdrawal, internal transfer) in USD terms.
 */
public record Transfer(
        TransferKind kind,
        String token,
        BigDecimal usdAmount,
        long timestampMs,
        String hash
) {
}
