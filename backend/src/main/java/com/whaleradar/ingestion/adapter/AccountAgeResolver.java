package com.whaleradar.ingestion.adapter;

import java.util.Optional;

/**
 * Auxiliary lookup of how long an account has existed on the exchange.
 */
public interface AccountAgeResolver {

    /**
     * Age in whole days since the account's first ledger activity; empty when the account has no history.
     */
    Optional<Long> resolveAgeDays(String address);
}
