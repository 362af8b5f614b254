package com.whaleradar.domain;

import java.util.Locale;

/**
 * Ledger movement type. OTHER covers funding, liquidations, vault moves and unknown deltas.
 */
public enum TransferKind {
    DEPOSIT,
    WITHDRAWAL,
    INTERNAL_TRANSFER,
    OTHER;

    public static TransferKind parse(String raw) {
        if (raw == null) {
            return OTHER;
        }
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "deposit" -> DEPOSIT;
            case "withdraw", "withdrawal" -> WITHDRAWAL;
            case "internaltransfer", "internal_transfer" -> INTERNAL_TRANSFER;
            default -> OTHER;
        };
    }
}
