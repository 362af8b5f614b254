package com.whaleradar.ingestion.adapter;

/**
 * Thrown when an upstream ledger call fails (HTTP error, timeout, malformed payload).
 * Recoverable: the affected address is retried on the next cycle.
 */
public class LedgerFetchException extends RuntimeException {

    public LedgerFetchException(String message) {
        super(message);
    }

    public LedgerFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
