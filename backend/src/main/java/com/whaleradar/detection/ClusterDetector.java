package com.whaleradar.detection;

import com.whaleradar.common.ContentDigest;
import com.whaleradar.detection.config.ClusterProperties;
import com.whaleradar.domain.ClusterDirection;
import com.whaleradar.domain.ClusterTrade;
import com.whaleradar.domain.LargeTrade;
import com.whaleradar.domain.TradeCluster;
import com.whaleradar.domain.TradeSide;
import com.whaleradar.ingestion.adapter.AccountAgeResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Evaluates one instrument's recent large trades as a candidate cluster: applies the cardinality,
 * participant, time-span, notional and alignment gates, then scores the survivors.
 * Returns a cluster only when the score reaches the configured minimum.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClusterDetector {

    private final ClusterProperties properties;
    private final SuspicionScorer scorer;
    private final AccountAgeResolver accountAgeResolver;
    private final Clock clock;

    public Optional<TradeCluster> detect(List<LargeTrade> trades, int recurringInstruments) {
        if (trades == null || trades.size() < properties.getMinTrades()) {
            return Optional.empty();
        }
        List<LargeTrade> ordered = trades.stream()
                .sorted(Comparator.comparingLong(LargeTrade::getTimestampMs))
                .collect(Collectors.toList());
        List<String> wallets = ordered.stream()
                .map(LargeTrade::getWalletAddress)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
        if (wallets.size() < properties.getMinWallets()) {
            return Optional.empty();
        }
        long firstMs = ordered.get(0).getTimestampMs();
        long lastMs = ordered.get(ordered.size() - 1).getTimestampMs();
        double spanMinutes = (lastMs - firstMs) / 60_000.0;
        if (spanMinutes > properties.getWindowMinutes()) {
            return Optional.empty();
        }
        BigDecimal total = ordered.stream()
                .map(LargeTrade::getNotional)
                .filter(n -> n != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.compareTo(properties.getMinNotionalUsd()) < 0) {
            return Optional.empty();
        }
        long sells = ordered.stream().filter(t -> t.getSide() == TradeSide.SELL).count();
        long buys = ordered.stream().filter(t -> t.getSide() == TradeSide.BUY).count();
        double alignment = (double) Math.max(sells, buys) / ordered.size();
        if (alignment < properties.getMinAlignment()) {
            return Optional.empty();
        }

        String instrument = mostFrequentInstrument(ordered);
        SuspicionSignals signals = new SuspicionSignals(spanMinutes, total, wallets.size(),
                averageWalletAgeDays(wallets), alignment, coefficientOfVariation(ordered), recurringInstruments);
        SuspicionScore score = scorer.score(signals);
        if (score.total() < properties.getMinScore()) {
            log.debug("Candidate on {} with {} wallets scored {}, below {}",
                    instrument, wallets.size(), score, properties.getMinScore());
            return Optional.empty();
        }

        ClusterDirection direction = sells > buys ? ClusterDirection.SHORT : ClusterDirection.LONG;
        String id = clusterId(firstMs, wallets.size(), instrument, direction);
        log.debug("Candidate {} on {} {}: {} wallets, {} trades, score {}",
                id.substring(0, 8), instrument, direction, wallets.size(), ordered.size(), score);
        return Optional.of(TradeCluster.builder()
                .id(id)
                .wallets(wallets)
                .instrument(instrument)
                .direction(direction)
                .trades(ordered.stream().map(ClusterTrade::from).collect(Collectors.toList()))
                .totalNotional(total)
                .walletCount(wallets.size())
                .tradeCount(ordered.size())
                .timeSpanMinutes(spanMinutes)
                .alignment(alignment)
                .score(score.total())
                .firstTradeMs(firstMs)
                .lastTradeMs(lastMs)
                .createdAt(Instant.now(clock))
                .build());
    }

    /** Deterministic: the same (first trade, wallet count, instrument, direction) always yields the same id. */
    public static String clusterId(long firstTradeMs, int walletCount, String instrument, ClusterDirection direction) {
        return ContentDigest.sha256(String.valueOf(firstTradeMs), String.valueOf(walletCount),
                instrument, direction.name());
    }

    private double averageWalletAgeDays(List<String> wallets) {
        return wallets.stream()
                .mapToLong(this::walletAgeDays)
                .average()
                .orElse(properties.getDefaultWalletAgeDays());
    }

    private long walletAgeDays(String wallet) {
        try {
            return accountAgeResolver.resolveAgeDays(wallet).orElse(properties.getDefaultWalletAgeDays());
        } catch (RuntimeException e) {
            log.warn("Account age lookup failed for {}, using {} days: {}",
                    wallet, properties.getDefaultWalletAgeDays(), e.getMessage());
            return properties.getDefaultWalletAgeDays();
        }
    }

    /** Population standard deviation over mean of trade notionals; 0 when the mean is 0. */
    static double coefficientOfVariation(List<LargeTrade> trades) {
        double[] values = trades.stream()
                .map(LargeTrade::getNotional)
                .mapToDouble(n -> n != null ? n.doubleValue() : 0.0)
                .toArray();
        if (values.length == 0) {
            return 0.0;
        }
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        if (mean == 0.0) {
            return 0.0;
        }
        double variance = 0.0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        variance /= values.length;
        return Math.sqrt(variance) / mean;
    }

    private static String mostFrequentInstrument(List<LargeTrade> trades) {
        Map<String, Long> counts = trades.stream()
                .collect(Collectors.groupingBy(LargeTrade::getInstrument, Collectors.counting()));
        return counts.entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse("");
    }
}
