package com.whaleradar.scan.health;

public enum UpstreamStatus {
    UNKNOWN,
    HEALTHY,
    DEGRADED
}
