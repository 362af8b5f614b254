package com.whaleradar.ingestion.adapter;

/**
 * Observer of upstream call outcomes (one callback per logical call, after retries).
 */
public interface LedgerCallListener {

    void onCallSucceeded(String requestType);

    void onCallFailed(String requestType, Exception cause);
}
