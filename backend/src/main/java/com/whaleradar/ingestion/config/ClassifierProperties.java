package com.whaleradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thresholds for findings on ordinary (non-elevated) addresses. Elevated addresses ignore them.
 */
@ConfigurationProperties(prefix = "whaleradar.classifier")
@NoArgsConstructor
@Getter
@Setter
public class ClassifierProperties {

    /** Minimum notional in USD for a short open to become a finding. */
    private BigDecimal shortThresholdUsd = new BigDecimal("25000000");

    /** Minimum USD amount for a stablecoin deposit to become a finding. */
    private BigDecimal depositThresholdUsd = new BigDecimal("20000000");

    /** Settlement assets whose deposits count as large deposits. Case-insensitive. */
    private List<String> stableTokens = List.of("USDC", "USDT");

    public Set<String> getStableTokensNormalized() {
        if (stableTokens == null || stableTokens.isEmpty()) {
            return Set.of();
        }
        return stableTokens.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.strip().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
