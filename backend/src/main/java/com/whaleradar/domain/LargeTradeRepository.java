package com.whaleradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Persistence for large_trades. Read by the cluster scan, written by the address scanner.
 */
public interface LargeTradeRepository extends MongoRepository<LargeTrade, String> {

    /** Trades inside the detection window at or above the size floor, newest first. */
    List<LargeTrade> findByTimestampMsGreaterThanEqualAndNotionalGreaterThanEqualOrderByTimestampMsDesc(
            long cutoffMs, BigDecimal minNotional);

    long deleteByTimestampMsLessThan(long cutoffMs);
}
