package com.whaleradar.detection;

/**
 * Per-signal points and their capped total.
 */
public record SuspicionScore(
        int timing,
        int notional,
        int wallets,
        int walletAge,
        int alignment,
        int homogeneity,
        int recurrence,
        int total
) {

    @Override
    public String toString() {
        return total + " (timing " + timing + ", notional " + notional + ", wallets " + wallets
                + ", age " + walletAge + ", alignment " + alignment + ", homogeneity " + homogeneity
                + ", recurrence " + recurrence + ")";
    }
}
