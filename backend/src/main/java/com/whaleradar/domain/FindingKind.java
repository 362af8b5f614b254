package com.whaleradar.domain;

public enum FindingKind {
    LARGE_DEPOSIT,
    LARGE_OPEN_SHORT,
    ELEVATED_ACTIVITY,
    /** Replaces a batch of findings that exceeds the per-address notification cap. */
    BATCH_SUMMARY
}
