package com.whaleradar.notification;

import com.whaleradar.domain.ClusterTrade;
import com.whaleradar.domain.Finding;
import com.whaleradar.domain.TradeCluster;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders findings, clusters and status updates as {@link WebhookMessage}s.
 */
public final class WebhookMessageFormatter {

    static final int MAX_CLUSTER_WALLETS_SHOWN = 10;

    private static final DateTimeFormatter UTC_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private WebhookMessageFormatter() {
    }

    public static WebhookMessage findings(String address, List<Finding> findings, boolean elevated) {
        String title = (elevated ? "ELEVATED WALLET " : "") + "Hyperliquid Alert - " + abbreviate(address);
        List<String> lines = new ArrayList<>();
        for (Finding f : findings) {
            lines.add(headline(f));
            lines.add("• Token: `" + f.token() + "` | " + f.detail());
            lines.add("• Notional: *" + usd(f.notional()) + "*");
            lines.add("• Time: `" + time(f.timestampMs()) + "`");
            if (f.sourceId() != null && !f.sourceId().isBlank()) {
                lines.add("• Ref: `" + f.sourceId() + "`");
            }
        }
        return new WebhookMessage(title, lines);
    }

    public static WebhookMessage cluster(TradeCluster cluster) {
        List<String> lines = new ArrayList<>();
        lines.add("*Suspicion score: " + cluster.getScore() + "/100*");
        lines.add("• Cluster: `" + cluster.shortId() + "`");
        lines.add("• Wallets: *" + cluster.getWalletCount() + "*");
        lines.add("• Instrument: *" + cluster.getInstrument() + "*");
        lines.add("• Direction: *" + cluster.getDirection() + "*");
        lines.add("• Total notional: *" + usd(cluster.getTotalNotional()) + "*");
        lines.add(String.format(Locale.ROOT, "• Time span: *%.1f minutes*", cluster.getTimeSpanMinutes()));
        lines.add(String.format(Locale.ROOT, "• Alignment: *%.0f%%*", cluster.getAlignment() * 100));
        lines.add("• First trade: `" + time(cluster.getFirstTradeMs()) + "`");
        lines.add("• Last trade: `" + time(cluster.getLastTradeMs()) + "`");
        lines.add("Wallets:");
        Map<String, BigDecimal> perWallet = notionalByWallet(cluster);
        perWallet.entrySet().stream()
                .limit(MAX_CLUSTER_WALLETS_SHOWN)
                .forEach(e -> lines.add(String.format(Locale.ROOT, "• `%s` ($%.1fM)",
                        abbreviate(e.getKey()), e.getValue().doubleValue() / 1_000_000d)));
        if (perWallet.size() > MAX_CLUSTER_WALLETS_SHOWN) {
            lines.add("• ... and " + (perWallet.size() - MAX_CLUSTER_WALLETS_SHOWN) + " more");
        }
        lines.add("All wallets added to the elevated watchlist.");
        return new WebhookMessage("SUSPICIOUS CLUSTER DETECTED", lines);
    }

    public static WebhookMessage status(StatusKind kind, Map<String, ?> details) {
        List<String> lines = new ArrayList<>();
        if (details != null) {
            details.forEach((label, value) -> lines.add("• " + label + ": *" + value + "*"));
        }
        return new WebhookMessage(statusTitle(kind), lines);
    }

    static String statusTitle(StatusKind kind) {
        return switch (kind) {
            case STARTUP -> "Whale radar started";
            case STATUS_REPORT -> "Whale radar status report";
            case UPSTREAM_DEGRADED -> "Hyperliquid API degraded";
            case UPSTREAM_RECOVERED -> "Hyperliquid API recovered";
        };
    }

    private static String headline(Finding f) {
        return switch (f.kind()) {
            case LARGE_DEPOSIT -> "*Large deposit*";
            case LARGE_OPEN_SHORT -> "*Very large short open*";
            case ELEVATED_ACTIVITY -> "*Elevated wallet activity*";
            case BATCH_SUMMARY -> "*Activity burst*";
        };
    }

    private static Map<String, BigDecimal> notionalByWallet(TradeCluster cluster) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (String wallet : cluster.getWallets()) {
            totals.put(wallet, BigDecimal.ZERO);
        }
        if (cluster.getTrades() != null) {
            for (ClusterTrade trade : cluster.getTrades()) {
                if (trade.notional() != null) {
                    totals.merge(trade.walletAddress(), trade.notional(), BigDecimal::add);
                }
            }
        }
        return totals;
    }

    /** 0x12345678...abcdef */
    static String abbreviate(String address) {
        if (address == null || address.length() <= 16) {
            return address;
        }
        return address.substring(0, 10) + "..." + address.substring(address.length() - 6);
    }

    static String usd(BigDecimal amount) {
        return String.format(Locale.ROOT, "$%,.0f", amount != null ? amount : BigDecimal.ZERO);
    }

    static String time(long epochMs) {
        return epochMs > 0 ? UTC_TIME.format(Instant.ofEpochMilli(epochMs)) : "unknown";
    }
}
