package com.whaleradar.notification;

/**
 * Operational message types sent besides per-address alerts and cluster alerts.
 */
public enum StatusKind {
    STARTUP,
    STATUS_REPORT,
    UPSTREAM_DEGRADED,
    UPSTREAM_RECOVERED
}
