package com.whaleradar.ingestion.config;

import com.whaleradar.common.RetryPolicy;
import com.whaleradar.ingestion.adapter.HyperliquidInfoClient;
import com.whaleradar.ingestion.adapter.WebClientHyperliquidInfoClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Hyperliquid info client, its retry policy and the outbound rate limiter.
 */
@Configuration
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy ledgerRetryPolicy(LedgerProperties properties) {
        LedgerProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), Math.max(1, retry.getMaxAttempts()));
    }

    @Bean
    public HyperliquidInfoClient hyperliquidInfoClient(WebClient.Builder webClientBuilder, LedgerProperties properties) {
        return new WebClientHyperliquidInfoClient(webClientBuilder, properties.getUserAgent());
    }

    @Bean(name = "ledgerRateLimiter")
    public RateLimiter ledgerRateLimiter(LedgerProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getRateLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("ledger", config);
    }
}
