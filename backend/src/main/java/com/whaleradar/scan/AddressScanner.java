package com.whaleradar.scan;

import com.whaleradar.common.ContentDigest;
import com.whaleradar.config.AsyncConfig;
import com.whaleradar.detection.config.ClusterProperties;
import com.whaleradar.domain.Fill;
import com.whaleradar.domain.Finding;
import com.whaleradar.domain.LargeTrade;
import com.whaleradar.domain.Transfer;
import com.whaleradar.ingestion.adapter.LedgerFetchException;
import com.whaleradar.ingestion.adapter.LedgerFetcher;
import com.whaleradar.ingestion.classifier.ActivityClassifier;
import com.whaleradar.ingestion.store.EventStore;
import com.whaleradar.notification.Notifier;
import com.whaleradar.scan.config.ScanProperties;
import com.whaleradar.watchlist.WatchlistManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One address iteration: resolve cursor, fetch fills and transfers side by side, archive large fills,
 * classify, de-duplicate, notify, then advance the cursor to the cycle start time.
 * A fetch failure aborts the iteration before anything is written and leaves the cursor where it was.
 */
@Component
@Slf4j
public class AddressScanner {

    private final LedgerFetcher ledgerFetcher;
    private final ActivityClassifier classifier;
    private final EventStore eventStore;
    private final WatchlistManager watchlistManager;
    private final Notifier notifier;
    private final ScanProperties scanProperties;
    private final BigDecimal largeTradeFloor;
    private final Executor ledgerFetchExecutor;

    public AddressScanner(LedgerFetcher ledgerFetcher,
                          ActivityClassifier classifier,
                          EventStore eventStore,
                          WatchlistManager watchlistManager,
                          Notifier notifier,
                          ScanProperties scanProperties,
                          ClusterProperties clusterProperties,
                          @Qualifier(AsyncConfig.LEDGER_FETCH_EXECUTOR) Executor ledgerFetchExecutor) {
        this.ledgerFetcher = ledgerFetcher;
        this.classifier = classifier;
        this.eventStore = eventStore;
        this.watchlistManager = watchlistManager;
        this.notifier = notifier;
        this.scanProperties = scanProperties;
        this.largeTradeFloor = clusterProperties.getMarketMinTradeSizeUsd();
        this.ledgerFetchExecutor = ledgerFetchExecutor;
    }

    /**
     * @param cycleStartMs wall-clock time the cycle started; becomes the new cursor on success
     * @throws LedgerFetchException when either fetch fails or the pair exceeds the fetch timeout
     */
    public AddressScanResult scan(String address, long cycleStartMs) {
        boolean elevated = watchlistManager.isElevated(address);
        String source = EventStore.cursorKey(address);
        long sinceMs = eventStore.getCursor(source, cycleStartMs - scanProperties.lookbackMs(elevated));

        CompletableFuture<List<Fill>> fillsFuture =
                CompletableFuture.supplyAsync(() -> ledgerFetcher.fetchFills(address, sinceMs), ledgerFetchExecutor);
        CompletableFuture<List<Transfer>> transfersFuture =
                CompletableFuture.supplyAsync(() -> ledgerFetcher.fetchTransfers(address, sinceMs), ledgerFetchExecutor);
        awaitBoth(address, fillsFuture, transfersFuture);
        List<Fill> fills = fillsFuture.join();
        List<Transfer> transfers = transfersFuture.join();

        int archived = archiveLargeFills(address, fills);
        List<Finding> findings = classifier.classify(address, fills, transfers, elevated);
        List<Finding> fresh = new ArrayList<>();
        for (Finding finding : findings) {
            String digest = findingDigest(finding);
            if (eventStore.isSeen(digest) || !eventStore.markSeen(digest)) {
                continue;
            }
            fresh.add(finding);
        }

        boolean summarized = false;
        boolean notified = false;
        if (!fresh.isEmpty()) {
            summarized = fresh.size() > scanProperties.getNotificationCap();
            List<Finding> outgoing = summarized ? List.of(Finding.summaryOf(address, fresh)) : fresh;
            log.info("{} new finding(s) for {} (elevated: {}{})",
                    fresh.size(), address, elevated, summarized ? ", summarized" : "");
            notified = notifier.notify(address, outgoing, elevated);
        }

        eventStore.setCursor(source, cycleStartMs);
        log.debug("Scanned {} since {}: {} fills, {} transfers, {} archived",
                address, sinceMs, fills.size(), transfers.size(), archived);
        return new AddressScanResult(address, fills.size(), transfers.size(), archived, fresh.size(),
                summarized, notified, null);
    }

    /** Idempotency key of a finding: (address, kind, source id, timestamp). */
    public static String findingDigest(Finding finding) {
        return ContentDigest.sha256(finding.address(), finding.kind().name(), finding.sourceId(),
                String.valueOf(finding.timestampMs()));
    }

    private int archiveLargeFills(String address, List<Fill> fills) {
        int archived = 0;
        for (Fill fill : fills) {
            if (fill.notional().compareTo(largeTradeFloor) >= 0) {
                eventStore.recordLargeTrade(LargeTrade.of(address, fill));
                archived++;
            }
        }
        return archived;
    }

    private void awaitBoth(String address, CompletableFuture<?> first, CompletableFuture<?> second) {
        try {
            CompletableFuture.allOf(first, second).get(scanProperties.getFetchTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LedgerFetchException) {
                throw (LedgerFetchException) cause;
            }
            throw new LedgerFetchException("Fetch failed for " + address + ": " + cause, cause);
        } catch (TimeoutException e) {
            first.cancel(true);
            second.cancel(true);
            throw new LedgerFetchException("Fetch timed out after " + scanProperties.getFetchTimeoutMs()
                    + " ms for " + address, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerFetchException("Interrupted while fetching " + address, e);
        }
    }
}
