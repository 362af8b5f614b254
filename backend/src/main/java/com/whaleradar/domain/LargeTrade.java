package com.whaleradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;

/**
 * Archived fill above the market-wide minimum trade size, kept for cross-address cluster scans.
 * Keyed by upstream trade id; re-archiving the same trade replaces the document.
 */
@Document(collection = "large_trades")
@CompoundIndex(name = "timestamp_notional", def = "{'timestampMs': -1, 'notional': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LargeTrade {

    /** Decimal128 holds 34 significant digits; notionals are rounded to cents before storage. */
    private static final int NOTIONAL_SCALE = 2;

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletAddress;
    private String instrument;
    private TradeSide side;
    private BigDecimal notional;
    private long timestampMs;
    private Instant recordedAt;

    public static LargeTrade of(String walletAddress, Fill fill) {
        LargeTrade t = new LargeTrade();
        t.setId(fill.tradeId() == null || fill.tradeId().isBlank() ? null : fill.tradeId());
        t.setWalletAddress(walletAddress == null ? null : walletAddress.toLowerCase(Locale.ROOT));
        t.setInstrument(fill.instrument());
        t.setSide(fill.side());
        t.setNotional(fill.notional().setScale(NOTIONAL_SCALE, RoundingMode.HALF_UP));
        t.setTimestampMs(fill.timestampMs());
        return t;
    }
}
