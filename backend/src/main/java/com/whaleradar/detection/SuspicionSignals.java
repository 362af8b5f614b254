package com.whaleradar.detection;

import java.math.BigDecimal;

/**
 * Inputs of the suspicion score, measured on one candidate cluster.
 *
 * @param timeSpanMinutes       minutes between first and last trade
 * @param totalNotional         sum of trade notionals in USD
 * @param walletCount           distinct participants
 * @param averageWalletAgeDays  mean account age of the participants
 * @param alignment             max(sells, buys) / trades, in [0, 1]
 * @param notionalVariation     coefficient of variation of trade notionals (0 = identical sizes)
 * @param recurringInstruments  other instruments on which at least two of the participants also traded
 */
public record SuspicionSignals(
        double timeSpanMinutes,
        BigDecimal totalNotional,
        int walletCount,
        double averageWalletAgeDays,
        double alignment,
        double notionalVariation,
        int recurringInstruments
) {
}
