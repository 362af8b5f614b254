package com.whaleradar.ingestion.classifier;

import com.whaleradar.domain.Fill;
import com.whaleradar.domain.Finding;
import com.whaleradar.domain.FindingKind;
import com.whaleradar.domain.Transfer;
import com.whaleradar.domain.TransferKind;
import com.whaleradar.ingestion.config.ClassifierProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns one address's fills and transfers into findings.
 * Elevated addresses: every deposit, withdrawal and fill is reported regardless of size.
 * Ordinary addresses: only stablecoin deposits at or above the deposit threshold and short opens
 * at or above the short threshold.
 * No I/O; output is ordered by timestamp ascending, with missing (zero) timestamps last.
 */
@Component
public class ActivityClassifier {

    static final Comparator<Finding> CHRONOLOGICAL = Comparator
            .comparing((Finding f) -> f.timestampMs() <= 0)
            .thenComparingLong(Finding::timestampMs);

    private final BigDecimal shortThresholdUsd;
    private final BigDecimal depositThresholdUsd;
    private final Set<String> stableTokens;

    public ActivityClassifier(ClassifierProperties properties) {
        this.shortThresholdUsd = properties.getShortThresholdUsd();
        this.depositThresholdUsd = properties.getDepositThresholdUsd();
        this.stableTokens = properties.getStableTokensNormalized();
    }

    public List<Finding> classify(String address, List<Fill> fills, List<Transfer> transfers, boolean elevated) {
        List<Finding> findings = new ArrayList<>();
        if (transfers != null) {
            for (Transfer transfer : transfers) {
                if (elevated ? isReportableMovement(transfer) : isLargeStableDeposit(transfer)) {
                    findings.add(fromTransfer(address, transfer, elevated));
                }
            }
        }
        if (fills != null) {
            for (Fill fill : fills) {
                if (elevated || isLargeShortOpen(fill)) {
                    findings.add(fromFill(address, fill, elevated));
                }
            }
        }
        findings.sort(CHRONOLOGICAL);
        return findings;
    }

    private static boolean isReportableMovement(Transfer transfer) {
        return transfer.kind() == TransferKind.DEPOSIT || transfer.kind() == TransferKind.WITHDRAWAL;
    }

    private boolean isLargeStableDeposit(Transfer transfer) {
        if (transfer.kind() != TransferKind.DEPOSIT || transfer.token() == null) {
            return false;
        }
        if (!stableTokens.contains(transfer.token().strip().toUpperCase(Locale.ROOT))) {
            return false;
        }
        return amountOf(transfer).compareTo(depositThresholdUsd) >= 0;
    }

    private boolean isLargeShortOpen(Fill fill) {
        return fill.isShortOpen() && fill.notional().compareTo(shortThresholdUsd) >= 0;
    }

    private static Finding fromTransfer(String address, Transfer transfer, boolean elevated) {
        FindingKind kind = elevated ? FindingKind.ELEVATED_ACTIVITY : FindingKind.LARGE_DEPOSIT;
        return new Finding(kind, address, transfer.token(), amountOf(transfer), transfer.timestampMs(),
                nullToEmpty(transfer.hash()), transfer.kind().name());
    }

    private static Finding fromFill(String address, Fill fill, boolean elevated) {
        FindingKind kind = elevated ? FindingKind.ELEVATED_ACTIVITY : FindingKind.LARGE_OPEN_SHORT;
        String label = fill.direction() == null || fill.direction().isBlank()
                ? fill.side().name()
                : fill.side().name() + " " + fill.direction();
        return new Finding(kind, address, fill.instrument(), fill.notional(), fill.timestampMs(),
                nullToEmpty(fill.tradeId()), label);
    }

    private static BigDecimal amountOf(Transfer transfer) {
        return transfer.usdAmount() != null ? transfer.usdAmount() : BigDecimal.ZERO;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
