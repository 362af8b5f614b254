package com.whaleradar.scan;

import java.util.List;

/**
 * Summary of one scan cycle.
 */
public record ScanCycleReport(
        long startedAtMs,
        List<AddressScanResult> addressResults,
        int newClusters,
        int walletsElevated
) {

    public long failedAddresses() {
        return addressResults.stream().filter(r -> !r.succeeded()).count();
    }

    public int freshFindings() {
        return addressResults.stream().mapToInt(AddressScanResult::freshFindings).sum();
    }
}
