package com.whaleradar.ingestion.classifier;

import com.whaleradar.domain.Fill;
import com.whaleradar.domain.Finding;
import com.whaleradar.domain.FindingKind;
import com.whaleradar.domain.TradeSide;
import com.whaleradar.domain.Transfer;
import com.whaleradar.domain.TransferKind;
import com.whaleradar.ingestion.config.ClassifierProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ActivityClassifierTest {

    private static final String ADDRESS = "0x1111111111111111111111111111111111111111";

    private ActivityClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ActivityClassifier(new ClassifierProperties());
    }

    @Test
    @DisplayName("elevated address: a $100 deposit is reported")
    void elevatedSmallDeposit_reported() {
        List<Finding> findings = classifier.classify(ADDRESS, List.of(),
                List.of(transfer(TransferKind.DEPOSIT, "USDC", "100", 1_000L)), true);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).kind()).isEqualTo(FindingKind.ELEVATED_ACTIVITY);
        assertThat(findings.get(0).detail()).isEqualTo("DEPOSIT");
    }

    @Test
    @DisplayName("ordinary address: a $100 deposit is ignored, a $30M deposit is reported")
    void ordinaryDeposit_thresholdApplies() {
        assertThat(classifier.classify(ADDRESS, List.of(),
                List.of(transfer(TransferKind.DEPOSIT, "USDC", "100", 1_000L)), false)).isEmpty();

        List<Finding> findings = classifier.classify(ADDRESS, List.of(),
                List.of(transfer(TransferKind.DEPOSIT, "USDC", "30000000", 1_000L)), false);
        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.LARGE_DEPOSIT);
    }

    @Test
    void ordinaryDeposit_exactlyAtThreshold_reported() {
        assertThat(classifier.classify(ADDRESS, List.of(),
                List.of(transfer(TransferKind.DEPOSIT, "usdt", "20000000", 1_000L)), false)).hasSize(1);
    }

    @Test
    void ordinaryAddress_nonStableOrNonDeposit_ignored() {
        List<Transfer> transfers = List.of(
                transfer(TransferKind.DEPOSIT, "ETH", "50000000", 1_000L),
                transfer(TransferKind.WITHDRAWAL, "USDC", "50000000", 2_000L),
                transfer(TransferKind.INTERNAL_TRANSFER, "USDC", "50000000", 3_000L));
        assertThat(classifier.classify(ADDRESS, List.of(), transfers, false)).isEmpty();
    }

    @Test
    void elevatedAddress_withdrawalReported_internalTransferNot() {
        List<Transfer> transfers = List.of(
                transfer(TransferKind.WITHDRAWAL, "USDC", "5", 1_000L),
                transfer(TransferKind.INTERNAL_TRANSFER, "USDC", "5", 2_000L));
        assertThat(classifier.classify(ADDRESS, List.of(), transfers, true))
                .extracting(Finding::detail)
                .containsExactly("WITHDRAWAL");
    }

    @Test
    @DisplayName("ordinary address: only short opens at or above the short threshold")
    void ordinaryFills_onlyLargeShortOpens() {
        List<Fill> fills = List.of(
                fill(TradeSide.SELL, "1000", "30000", "Open Short", 1_000L),   // 30M short
                fill(TradeSide.BUY, "1000", "30000", "Open Long", 2_000L),     // 30M long
                fill(TradeSide.SELL, "100", "30000", "Open Short", 3_000L));   // 3M short

        List<Finding> findings = classifier.classify(ADDRESS, fills, List.of(), false);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).kind()).isEqualTo(FindingKind.LARGE_OPEN_SHORT);
        assertThat(findings.get(0).notional()).isEqualByComparingTo("30000000");
        assertThat(findings.get(0).detail()).isEqualTo("SELL Open Short");
    }

    @Test
    void elevatedFills_allReported() {
        List<Fill> fills = List.of(
                fill(TradeSide.BUY, "0.01", "30000", "Open Long", 1_000L),
                fill(TradeSide.SELL, "0.01", "30000", "Close Long", 2_000L));
        assertThat(classifier.classify(ADDRESS, fills, List.of(), true))
                .extracting(Finding::kind)
                .containsOnly(FindingKind.ELEVATED_ACTIVITY)
                .hasSize(2);
    }

    @Test
    @DisplayName("findings ordered by timestamp, missing timestamps last")
    void ordering_zeroTimestampsLast() {
        List<Fill> fills = List.of(
                fill(TradeSide.BUY, "1", "1", "", 0L),
                fill(TradeSide.BUY, "1", "1", "", 3_000L));
        List<Transfer> transfers = List.of(transfer(TransferKind.DEPOSIT, "USDC", "1", 2_000L));

        List<Finding> findings = classifier.classify(ADDRESS, fills, transfers, true);

        assertThat(findings).extracting(Finding::timestampMs).containsExactly(2_000L, 3_000L, 0L);
    }

    @Test
    void nullInputs_noFindings() {
        assertThat(classifier.classify(ADDRESS, null, null, true)).isEmpty();
    }

    private static Transfer transfer(TransferKind kind, String token, String usd, long ts) {
        return new Transfer(kind, token, new BigDecimal(usd), ts, "0xhash" + ts);
    }

    private static Fill fill(TradeSide side, String size, String price, String dir, long ts) {
        return new Fill("BTC", new BigDecimal(size), new BigDecimal(price), side, dir, ts, "tid" + ts, "oid" + ts);
    }
}
