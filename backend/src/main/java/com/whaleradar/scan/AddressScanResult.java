package com.whaleradar.scan;

/**
 * Outcome of one address iteration.
 *
 * @param freshFindings findings that passed de-duplication in this pass
 * @param summarized    true when the findings went out as one summary because they exceeded the cap
 * @param error         failure message when the iteration aborted; null on success
 */
public record AddressScanResult(
        String address,
        int fills,
        int transfers,
        int archivedTrades,
        int freshFindings,
        boolean summarized,
        boolean notified,
        String error
) {

    public static AddressScanResult failed(String address, String error) {
        return new AddressScanResult(address, 0, 0, 0, 0, false, false, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
