package com.whaleradar.ingestion.adapter;

import com.whaleradar.domain.Transfer;
import com.whaleradar.domain.TransferKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HyperliquidAccountAgeResolverTest {

    private static final String ADDRESS = "0x3333333333333333333333333333333333333333";
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    LedgerFetcher ledgerFetcher;

    @Test
    void ageFromEarliestLedgerUpdate() {
        long tenDaysAgo = NOW.minus(Duration.ofDays(10)).toEpochMilli();
        long twoDaysAgo = NOW.minus(Duration.ofDays(2)).toEpochMilli();
        when(ledgerFetcher.fetchTransfers(ADDRESS, 0L)).thenReturn(List.of(
                new Transfer(TransferKind.DEPOSIT, "USDC", BigDecimal.TEN, twoDaysAgo, "0x2"),
                new Transfer(TransferKind.DEPOSIT, "USDC", BigDecimal.TEN, tenDaysAgo, "0x1")));

        HyperliquidAccountAgeResolver resolver =
                new HyperliquidAccountAgeResolver(ledgerFetcher, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(resolver.resolveAgeDays(ADDRESS)).contains(10L);
    }

    @Test
    void noHistory_empty() {
        when(ledgerFetcher.fetchTransfers(ADDRESS, 0L)).thenReturn(List.of());

        HyperliquidAccountAgeResolver resolver =
                new HyperliquidAccountAgeResolver(ledgerFetcher, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(resolver.resolveAgeDays(ADDRESS)).isEmpty();
    }
}
