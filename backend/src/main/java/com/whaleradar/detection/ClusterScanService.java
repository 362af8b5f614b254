package com.whaleradar.detection;

import com.whaleradar.common.ContentDigest;
import com.whaleradar.detection.config.ClusterProperties;
import com.whaleradar.domain.LargeTrade;
import com.whaleradar.domain.TradeCluster;
import com.whaleradar.ingestion.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Market-wide cluster pass over the large-trade archive. Groups the detection window by instrument,
 * runs the detector per instrument and keeps only clusters never reported before.
 * Notification and watchlist promotion are left to the caller. A store failure on one instrument skips
 * that instrument only; clusters already claimed in this pass are still returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClusterScanService {

    static final String CLUSTER_DIGEST_PREFIX = "cluster";

    private final ClusterProperties properties;
    private final ClusterDetector detector;
    private final EventStore eventStore;

    /**
     * @return clusters detected for the first time in this pass, already persisted
     */
    public List<TradeCluster> scan() {
        if (!properties.isEnabled()) {
            return List.of();
        }
        List<LargeTrade> recent = eventStore.recentLargeTrades(properties.getWindowMinutes(),
                properties.getMarketMinTradeSizeUsd());
        if (recent.isEmpty()) {
            log.debug("Cluster scan: no large trades in the last {} minutes", properties.getWindowMinutes());
            return List.of();
        }
        Map<String, List<LargeTrade>> byInstrument = recent.stream()
                .collect(Collectors.groupingBy(LargeTrade::getInstrument, TreeMap::new, Collectors.toList()));
        Map<String, Set<String>> walletsByInstrument = new TreeMap<>();
        byInstrument.forEach((instrument, trades) -> walletsByInstrument.put(instrument,
                trades.stream().map(LargeTrade::getWalletAddress).collect(Collectors.toSet())));

        List<TradeCluster> detected = new ArrayList<>();
        for (Map.Entry<String, List<LargeTrade>> entry : byInstrument.entrySet()) {
            if (entry.getValue().size() < properties.getMinTrades()) {
                continue;
            }
            int recurring = recurringInstruments(entry.getKey(), walletsByInstrument, properties.getMinWallets());
            try {
                Optional<TradeCluster> candidate = detector.detect(entry.getValue(), recurring);
                candidate.filter(this::acceptOnce).ifPresent(detected::add);
            } catch (DataAccessException e) {
                log.warn("Cluster check for {} skipped, store unavailable: {}", entry.getKey(), e.getMessage());
            }
        }
        log.info("Cluster scan: {} large trades on {} instruments, {} new clusters",
                recent.size(), byInstrument.size(), detected.size());
        return detected;
    }

    /**
     * A recurring signature (same cluster id) is reported once; later detections are dropped.
     * Once the digest is claimed the cluster is reported even if storing the document fails,
     * since no later pass would report it.
     */
    private boolean acceptOnce(TradeCluster cluster) {
        String digest = clusterDigest(cluster.getId());
        if (eventStore.isSeen(digest) || !eventStore.markSeen(digest)) {
            log.debug("Cluster {} already reported", cluster.shortId());
            return false;
        }
        try {
            if (!eventStore.saveCluster(cluster)) {
                return false;
            }
        } catch (DataAccessException e) {
            log.warn("Cluster {} claimed but not stored: {}", cluster.shortId(), e.getMessage());
        }
        log.info("New cluster {} on {} {}: {} wallets, score {}", cluster.shortId(), cluster.getInstrument(),
                cluster.getDirection(), cluster.getWalletCount(), cluster.getScore());
        return true;
    }

    public static String clusterDigest(String clusterId) {
        return ContentDigest.sha256(CLUSTER_DIGEST_PREFIX, clusterId);
    }

    /**
     * Other instruments on which at least {@code minShared} of this instrument's wallets also traded.
     */
    static int recurringInstruments(String instrument, Map<String, Set<String>> walletsByInstrument, int minShared) {
        Set<String> wallets = walletsByInstrument.getOrDefault(instrument, Set.of());
        int count = 0;
        for (Map.Entry<String, Set<String>> other : walletsByInstrument.entrySet()) {
            if (other.getKey().equals(instrument)) {
                continue;
            }
            Set<String> shared = new HashSet<>(wallets);
            shared.retainAll(other.getValue());
            if (shared.size() >= Math.max(2, minShared)) {
                count++;
            }
        }
        return count;
    }
}
