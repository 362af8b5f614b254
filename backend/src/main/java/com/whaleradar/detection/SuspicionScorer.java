package com.whaleradar.detection;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Weighted suspicion score in [0, 100]. Every signal has its own cap below the default minimum
 * reporting score, so no single signal qualifies a cluster on its own.
 */
@Component
public class SuspicionScorer {

    public static final int MAX_SCORE = 100;

    public static final int TIMING_CAP = 25;
    public static final int NOTIONAL_CAP = 20;
    public static final int WALLETS_CAP = 15;
    public static final int WALLET_AGE_CAP = 15;
    public static final int ALIGNMENT_CAP = 10;
    public static final int HOMOGENEITY_CAP = 15;
    public static final int RECURRENCE_CAP = 10;

    /** Total notional that earns the full notional points. */
    public static final BigDecimal NOTIONAL_REFERENCE_USD = new BigDecimal("100000000");
    public static final int POINTS_PER_WALLET = 5;
    public static final int POINTS_PER_RECURRING_INSTRUMENT = 5;
    /** Alignment points start above this ratio and reach the cap at 1.0. */
    public static final double ALIGNMENT_FLOOR = 0.80;
    /** Coefficient of variation at which homogeneity points reach zero. */
    public static final double VARIATION_CEILING = 0.5;

    public SuspicionScore score(SuspicionSignals signals) {
        int timing = timingPoints(signals.timeSpanMinutes());
        int notional = notionalPoints(signals.totalNotional());
        int wallets = Math.min(WALLETS_CAP, Math.max(0, signals.walletCount()) * POINTS_PER_WALLET);
        int age = walletAgePoints(signals.averageWalletAgeDays());
        int alignment = alignmentPoints(signals.alignment());
        int homogeneity = homogeneityPoints(signals.notionalVariation());
        int recurrence = Math.min(RECURRENCE_CAP,
                Math.max(0, signals.recurringInstruments()) * POINTS_PER_RECURRING_INSTRUMENT);
        int total = Math.min(MAX_SCORE, timing + notional + wallets + age + alignment + homogeneity + recurrence);
        return new SuspicionScore(timing, notional, wallets, age, alignment, homogeneity, recurrence, total);
    }

    static int timingPoints(double spanMinutes) {
        if (spanMinutes < 1) {
            return TIMING_CAP;
        }
        if (spanMinutes < 5) {
            return 20;
        }
        if (spanMinutes < 15) {
            return 14;
        }
        if (spanMinutes < 30) {
            return 8;
        }
        if (spanMinutes < 60) {
            return 3;
        }
        return 0;
    }

    static int notionalPoints(BigDecimal totalNotional) {
        if (totalNotional == null || totalNotional.signum() <= 0) {
            return 0;
        }
        double ratio = totalNotional.divide(NOTIONAL_REFERENCE_USD, MathContext.DECIMAL64).doubleValue();
        return (int) Math.min(NOTIONAL_CAP, Math.round(ratio * NOTIONAL_CAP));
    }

    /** Younger accounts score higher. */
    static int walletAgePoints(double averageAgeDays) {
        if (averageAgeDays < 3) {
            return WALLET_AGE_CAP;
        }
        if (averageAgeDays < 7) {
            return 10;
        }
        if (averageAgeDays < 14) {
            return 5;
        }
        return 0;
    }

    static int alignmentPoints(double alignment) {
        if (alignment <= ALIGNMENT_FLOOR) {
            return 0;
        }
        double scaled = (Math.min(1.0, alignment) - ALIGNMENT_FLOOR) / (1.0 - ALIGNMENT_FLOOR) * ALIGNMENT_CAP;
        return (int) Math.min(ALIGNMENT_CAP, Math.round(scaled));
    }

    static int homogeneityPoints(double variation) {
        if (Double.isNaN(variation)) {
            return 0;
        }
        double factor = Math.max(0.0, 1.0 - Math.max(0.0, variation) / VARIATION_CEILING);
        return (int) Math.round(HOMOGENEITY_CAP * factor);
    }
}
