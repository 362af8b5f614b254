package com.whaleradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upstream ledger (Hyperliquid info API) client settings.
 */
@ConfigurationProperties(prefix = "whaleradar.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** Info endpoint accepting {"type": ..., "user": ...} POST bodies. */
    private String infoUrl = "https://api.hyperliquid.xyz/info";

    /** Per-request timeout in ms. A timeout counts as a failed attempt. */
    private long timeoutMs = 10_000;

    /** Outbound request cap per second across all address workers. */
    private int maxRequestsPerSecond = 10;

    /** Max wait in ms for a rate limiter permit before the call is failed. */
    private long rateLimiterTimeoutMs = 5_000;

    private String userAgent = "whale-radar/0.1";

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        /** Base delay in ms for first retry; doubles each attempt. */
        private long baseDelayMs = 500L;

        /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
        private double jitterFactor = 0.2;

        /** Total attempts per call, including the first. */
        private int maxAttempts = 3;
    }
}
