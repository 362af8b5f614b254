package com.whaleradar.ingestion.adapter;

import com.whaleradar.config.CaffeineConfig;
import com.whaleradar.domain.Transfer;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Account age from the earliest non-funding ledger update (first deposit in practice).
 * Cached per address; failures propagate as {@link LedgerFetchException} and are not cached.
 */
@Component
@RequiredArgsConstructor
public class HyperliquidAccountAgeResolver implements AccountAgeResolver {

    private final LedgerFetcher ledgerFetcher;
    private final Clock clock;

    @Override
    @Cacheable(cacheNames = CaffeineConfig.ACCOUNT_AGE_CACHE, key = "#address.toLowerCase()")
    public Optional<Long> resolveAgeDays(String address) {
        List<Transfer> history = ledgerFetcher.fetchTransfers(address, 0L);
        OptionalLong firstMs = history.stream()
                .mapToLong(Transfer::timestampMs)
                .filter(ts -> ts > 0)
                .min();
        if (firstMs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Math.max(0L, Duration.ofMillis(clock.millis() - firstMs.getAsLong()).toDays()));
    }
}
