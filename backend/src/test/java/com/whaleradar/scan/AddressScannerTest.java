package com.whaleradar.scan;

import com.whaleradar.detection.config.ClusterProperties;
import com.whaleradar.domain.Fill;
import com.whaleradar.domain.Finding;
import com.whaleradar.domain.FindingKind;
import com.whaleradar.domain.LargeTrade;
import com.whaleradar.domain.TradeSide;
import com.whaleradar.ingestion.adapter.LedgerFetchException;
import com.whaleradar.ingestion.adapter.LedgerFetcher;
import com.whaleradar.ingestion.classifier.ActivityClassifier;
import com.whaleradar.ingestion.config.ClassifierProperties;
import com.whaleradar.ingestion.store.EventStore;
import com.whaleradar.notification.Notifier;
import com.whaleradar.scan.config.ScanProperties;
import com.whaleradar.watchlist.WatchlistManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AddressScannerTest {

    private static final String ADDRESS = "0x2222222222222222222222222222222222222222";
    private static final String CURSOR_KEY = EventStore.cursorKey(ADDRESS);
    private static final long CYCLE_START = 1_700_000_000_000L;

    @Mock
    LedgerFetcher ledgerFetcher;
    @Mock
    EventStore eventStore;
    @Mock
    WatchlistManager watchlistManager;
    @Mock
    Notifier notifier;

    private ScanProperties scanProperties;
    private AddressScanner scanner;

    @BeforeEach
    void setUp() {
        scanProperties = new ScanProperties();
        scanner = new AddressScanner(ledgerFetcher, new ActivityClassifier(new ClassifierProperties()), eventStore,
                watchlistManager, notifier, scanProperties, new ClusterProperties(), Runnable::run);
    }

    @Test
    void largeShortOpen_archivedNotifiedAndCursorAdvancedToCycleStart() {
        long since = CYCLE_START - 5_000L;
        when(eventStore.getCursor(eq(CURSOR_KEY), anyLong())).thenReturn(since);
        Fill shortOpen = fill("BTC", "1000", "30000", TradeSide.SELL, CYCLE_START - 1_000L, "t-1");
        when(ledgerFetcher.fetchFills(ADDRESS, since)).thenReturn(List.of(shortOpen));
        when(ledgerFetcher.fetchTransfers(ADDRESS, since)).thenReturn(List.of());
        when(eventStore.isSeen(anyString())).thenReturn(false);
        when(eventStore.markSeen(anyString())).thenReturn(true);
        when(notifier.notify(eq(ADDRESS), anyList(), eq(false))).thenReturn(true);

        AddressScanResult result = scanner.scan(ADDRESS, CYCLE_START);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.archivedTrades()).isEqualTo(1);
        assertThat(result.freshFindings()).isEqualTo(1);
        assertThat(result.notified()).isTrue();
        ArgumentCaptor<LargeTrade> archived = ArgumentCaptor.forClass(LargeTrade.class);
        verify(eventStore).recordLargeTrade(archived.capture());
        assertThat(archived.getValue().getId()).isEqualTo("t-1");
        assertThat(archived.getValue().getWalletAddress()).isEqualTo(ADDRESS);
        verify(eventStore).setCursor(CURSOR_KEY, CYCLE_START);
    }

    @Test
    void firstScan_cursorDefaultsToLookbackBeforeCycleStart() {
        long expectedDefault = CYCLE_START - 10 * 60_000L;
        when(eventStore.getCursor(CURSOR_KEY, expectedDefault)).thenReturn(expectedDefault);

        AddressScanResult result = scanner.scan(ADDRESS, CYCLE_START);

        assertThat(result.freshFindings()).isZero();
        verify(ledgerFetcher).fetchFills(ADDRESS, expectedDefault);
        verify(ledgerFetcher).fetchTransfers(ADDRESS, expectedDefault);
        verify(notifier, never()).notify(anyString(), anyList(), anyBoolean());
        verify(eventStore).setCursor(CURSOR_KEY, CYCLE_START);
    }

    @Test
    void elevatedAddress_usesLongLookback() {
        long expectedDefault = CYCLE_START - 48 * 3_600_000L;
        when(watchlistManager.isElevated(ADDRESS)).thenReturn(true);
        when(eventStore.getCursor(CURSOR_KEY, expectedDefault)).thenReturn(expectedDefault);

        scanner.scan(ADDRESS, CYCLE_START);

        verify(ledgerFetcher).fetchFills(ADDRESS, expectedDefault);
    }

    @Test
    void alreadySeenFinding_notNotifiedAgain() {
        when(eventStore.getCursor(eq(CURSOR_KEY), anyLong())).thenReturn(0L);
        when(ledgerFetcher.fetchFills(ADDRESS, 0L))
                .thenReturn(List.of(fill("ETH", "10000", "3000", TradeSide.SELL, CYCLE_START - 1_000L, "t-2")));
        when(eventStore.isSeen(anyString())).thenReturn(true);

        AddressScanResult result = scanner.scan(ADDRESS, CYCLE_START);

        assertThat(result.freshFindings()).isZero();
        verify(eventStore, never()).markSeen(anyString());
        verify(notifier, never()).notify(anyString(), anyList(), anyBoolean());
        verify(eventStore).setCursor(CURSOR_KEY, CYCLE_START);
    }

    @Test
    void lostMarkSeenRace_findingDropped() {
        when(eventStore.getCursor(eq(CURSOR_KEY), anyLong())).thenReturn(0L);
        when(ledgerFetcher.fetchFills(ADDRESS, 0L))
                .thenReturn(List.of(fill("ETH", "10000", "3000", TradeSide.SELL, CYCLE_START - 1_000L, "t-3")));
        when(eventStore.isSeen(anyString())).thenReturn(false);
        when(eventStore.markSeen(anyString())).thenReturn(false);

        assertThat(scanner.scan(ADDRESS, CYCLE_START).freshFindings()).isZero();
        verify(notifier, never()).notify(anyString(), anyList(), anyBoolean());
    }

    @Test
    @SuppressWarnings("unchecked")
    void burstAboveCap_sentAsSingleSummary() {
        when(watchlistManager.isElevated(ADDRESS)).thenReturn(true);
        when(eventStore.getCursor(eq(CURSOR_KEY), anyLong())).thenReturn(0L);
        List<Fill> fills = new ArrayList<>();
        for (int i = 0; i < 21; i++) {
            fills.add(fill("SOL", "1", "100", TradeSide.BUY, CYCLE_START - 60_000L + i, "t-" + i));
        }
        when(ledgerFetcher.fetchFills(ADDRESS, 0L)).thenReturn(fills);
        when(eventStore.isSeen(anyString())).thenReturn(false);
        when(eventStore.markSeen(anyString())).thenReturn(true);
        when(notifier.notify(eq(ADDRESS), anyList(), eq(true))).thenReturn(true);

        AddressScanResult result = scanner.scan(ADDRESS, CYCLE_START);

        assertThat(result.freshFindings()).isEqualTo(21);
        assertThat(result.summarized()).isTrue();
        ArgumentCaptor<List<Finding>> sent = ArgumentCaptor.forClass(List.class);
        verify(notifier).notify(eq(ADDRESS), sent.capture(), eq(true));
        assertThat(sent.getValue()).hasSize(1);
        assertThat(sent.getValue().get(0).kind()).isEqualTo(FindingKind.BATCH_SUMMARY);
        assertThat(sent.getValue().get(0).notional()).isEqualByComparingTo("2100");
        assertThat(sent.getValue().get(0).timestampMs()).isEqualTo(CYCLE_START - 60_000L + 20);
    }

    @Test
    void burstAtCap_sentIndividually() {
        scanProperties.setNotificationCap(2);
        when(watchlistManager.isElevated(ADDRESS)).thenReturn(true);
        when(eventStore.getCursor(eq(CURSOR_KEY), anyLong())).thenReturn(0L);
        when(ledgerFetcher.fetchFills(ADDRESS, 0L)).thenReturn(List.of(
                fill("SOL", "1", "100", TradeSide.BUY, 1_000L, "a"),
                fill("SOL", "1", "100", TradeSide.BUY, 2_000L, "b")));
        when(eventStore.isSeen(anyString())).thenReturn(false);
        when(eventStore.markSeen(anyString())).thenReturn(true);

        AddressScanResult result = scanner.scan(ADDRESS, CYCLE_START);

        assertThat(result.summarized()).isFalse();
        verify(notifier).notify(eq(ADDRESS), any(), eq(true));
    }

    @Test
    void fetchFailure_propagatesAndLeavesCursorUntouched() {
        when(eventStore.getCursor(eq(CURSOR_KEY), anyLong())).thenReturn(0L);
        when(ledgerFetcher.fetchFills(ADDRESS, 0L)).thenThrow(new LedgerFetchException("Info API 502"));

        assertThatThrownBy(() -> scanner.scan(ADDRESS, CYCLE_START))
                .isInstanceOf(LedgerFetchException.class)
                .hasMessageContaining("Info API 502");

        verify(eventStore, never()).setCursor(anyString(), anyLong());
        verify(eventStore, never()).recordLargeTrade(any());
        verify(notifier, never()).notify(anyString(), anyList(), anyBoolean());
    }

    @Test
    void findingDigest_dependsOnSourceAndTimestamp() {
        Finding a = new Finding(FindingKind.LARGE_DEPOSIT, ADDRESS, "USDC", BigDecimal.TEN, 1L, "h1", "DEPOSIT");
        Finding sameKey = new Finding(FindingKind.LARGE_DEPOSIT, ADDRESS, "USDC", BigDecimal.ONE, 1L, "h1", "DEPOSIT");
        Finding otherTime = new Finding(FindingKind.LARGE_DEPOSIT, ADDRESS, "USDC", BigDecimal.TEN, 2L, "h1", "DEPOSIT");

        assertThat(AddressScanner.findingDigest(a)).isEqualTo(AddressScanner.findingDigest(sameKey));
        assertThat(AddressScanner.findingDigest(a)).isNotEqualTo(AddressScanner.findingDigest(otherTime));
    }

    private static Fill fill(String coin, String size, String price, TradeSide side, long ts, String tid) {
        return new Fill(coin, new BigDecimal(size), new BigDecimal(price), side, "", ts, tid, "o-" + tid);
    }
}
