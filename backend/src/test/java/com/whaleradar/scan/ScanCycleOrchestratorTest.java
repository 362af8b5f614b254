package com.whaleradar.scan;

import com.whaleradar.detection.ClusterScanService;
import com.whaleradar.domain.ClusterDirection;
import com.whaleradar.domain.TradeCluster;
import com.whaleradar.ingestion.adapter.LedgerFetchException;
import com.whaleradar.ingestion.store.EventStore;
import com.whaleradar.notification.Notifier;
import com.whaleradar.scan.config.ScanProperties;
import com.whaleradar.scan.health.ScanStats;
import com.whaleradar.watchlist.WatchlistManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanCycleOrchestratorTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final String A = "0xaaaa000000000000000000000000000000000001";
    private static final String B = "0xbbbb000000000000000000000000000000000002";

    @Mock
    AddressScanner addressScanner;
    @Mock
    ClusterScanService clusterScanService;
    @Mock
    WatchlistManager watchlistManager;
    @Mock
    EventStore eventStore;
    @Mock
    Notifier notifier;

    private ScanStats stats;
    private ScanCycleOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        stats = new ScanStats(clock);
        orchestrator = new ScanCycleOrchestrator(addressScanner, clusterScanService, watchlistManager, eventStore,
                notifier, stats, new ScanProperties(), clock, Runnable::run);
    }

    @Test
    void failingAddress_doesNotStopOthersOrClusterPass() {
        when(watchlistManager.watchedAddresses()).thenReturn(List.of(A, B));
        when(addressScanner.scan(A, NOW)).thenThrow(new LedgerFetchException("Info API 502"));
        when(addressScanner.scan(B, NOW)).thenReturn(new AddressScanResult(B, 2, 1, 0, 1, false, true, null));
        when(clusterScanService.scan()).thenReturn(List.of());

        ScanCycleReport report = orchestrator.runCycle();

        assertThat(report.startedAtMs()).isEqualTo(NOW);
        assertThat(report.addressResults()).extracting(AddressScanResult::address).containsExactly(A, B);
        assertThat(report.failedAddresses()).isEqualTo(1);
        assertThat(report.freshFindings()).isEqualTo(1);
        assertThat(report.addressResults().get(0).error()).contains("Info API 502");

        ScanStats.Snapshot snapshot = stats.snapshot();
        assertThat(snapshot.addressFailures()).isEqualTo(1);
        assertThat(snapshot.addressesScanned()).isEqualTo(1);
        assertThat(snapshot.alertsSent()).isEqualTo(1);
        assertThat(snapshot.cyclesCompleted()).isEqualTo(1);
        assertThat(snapshot.clusterScansCompleted()).isEqualTo(1);
    }

    @Test
    void storeOutageForOneAddress_recordedAsFailure() {
        when(watchlistManager.watchedAddresses()).thenReturn(List.of(A));
        when(addressScanner.scan(A, NOW)).thenThrow(new DataAccessResourceFailureException("mongo down"));
        when(clusterScanService.scan()).thenReturn(List.of());

        ScanCycleReport report = orchestrator.runCycle();

        assertThat(report.failedAddresses()).isEqualTo(1);
    }

    @Test
    void clusterPass_runsAfterAllAddresses() {
        when(watchlistManager.watchedAddresses()).thenReturn(List.of(A, B));
        when(addressScanner.scan(anyString(), anyLong()))
                .thenAnswer(inv -> new AddressScanResult(inv.getArgument(0), 0, 0, 0, 0, false, false, null));
        when(clusterScanService.scan()).thenReturn(List.of());

        orchestrator.runCycle();

        InOrder order = inOrder(addressScanner, clusterScanService);
        order.verify(addressScanner).scan(A, NOW);
        order.verify(addressScanner).scan(B, NOW);
        order.verify(clusterScanService).scan();
    }

    @Test
    void newCluster_notifiedAndWalletsPromotedWithReason() {
        TradeCluster cluster = cluster("abcdef0123456789", 77);
        when(clusterScanService.scan()).thenReturn(List.of(cluster));
        when(notifier.notifyCluster(cluster)).thenReturn(true);
        when(watchlistManager.promote(List.of(A, B), "Cluster abcdef01 (score: 77)")).thenReturn(List.of(A, B));

        ScanCycleOrchestrator.ClusterPassResult result = orchestrator.runClusterPass();

        assertThat(result.clusters()).isEqualTo(1);
        assertThat(result.elevated()).isEqualTo(2);
        ScanStats.Snapshot snapshot = stats.snapshot();
        assertThat(snapshot.clustersDetected()).isEqualTo(1);
        assertThat(snapshot.alertsSent()).isEqualTo(1);
        assertThat(snapshot.walletsElevated()).isEqualTo(2);
    }

    @Test
    void promotionFailure_doesNotAbortPass() {
        TradeCluster cluster = cluster("0123456789abcdef", 80);
        when(clusterScanService.scan()).thenReturn(List.of(cluster));
        when(watchlistManager.promote(anyCollection(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        ScanCycleOrchestrator.ClusterPassResult result = orchestrator.runClusterPass();

        assertThat(result.clusters()).isEqualTo(1);
        assertThat(result.elevated()).isZero();
        verify(notifier).notifyCluster(cluster);
    }

    @Test
    void clusterScanFailure_reportedAsEmptyPass() {
        when(clusterScanService.scan()).thenThrow(new IllegalStateException("boom"));

        ScanCycleOrchestrator.ClusterPassResult result = orchestrator.runClusterPass();

        assertThat(result.clusters()).isZero();
        verify(notifier, never()).notifyCluster(any());
    }

    @Test
    void resetCursor_unwatchedAddress_empty() {
        when(watchlistManager.isWatched(A)).thenReturn(false);

        assertThat(orchestrator.resetCursor(A)).isEmpty();
        verify(eventStore, never()).resetCursor(anyString(), anyLong());
    }

    @Test
    void resetCursor_watchedAddress_rewindsByLookback() {
        String mixedCase = "0xAAAA000000000000000000000000000000000001";
        when(watchlistManager.isWatched(mixedCase)).thenReturn(true);
        when(watchlistManager.isElevated(A)).thenReturn(true);

        OptionalLong cursor = orchestrator.resetCursor(mixedCase);

        long expected = NOW - 48 * 3_600_000L;
        assertThat(cursor).hasValue(expected);
        verify(eventStore).resetCursor(EventStore.cursorKey(A), expected);
    }

    private static TradeCluster cluster(String id, int score) {
        return TradeCluster.builder()
                .id(id)
                .wallets(List.of(A, B))
                .instrument("BTC")
                .direction(ClusterDirection.SHORT)
                .trades(List.of())
                .totalNotional(new BigDecimal("60000000"))
                .walletCount(2)
                .tradeCount(3)
                .alignment(1.0)
                .score(score)
                .build();
    }
}
