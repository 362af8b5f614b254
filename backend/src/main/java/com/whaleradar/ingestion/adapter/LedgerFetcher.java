package com.whaleradar.ingestion.adapter;

import com.whaleradar.domain.Fill;
import com.whaleradar.domain.Transfer;

import java.util.List;

/**
 * Source of an address's trade and ledger history. Results are filtered to {@code timestamp >= sinceMs};
 * an empty list means no new activity. Failures (timeout, non-2xx, malformed payload) raise
 * {@link LedgerFetchException}.
 */
public interface LedgerFetcher {

    List<Fill> fetchFills(String address, long sinceMs);

    List<Transfer> fetchTransfers(String address, long sinceMs);
}
