package com.whaleradar.domain;

/**
 * How an address reached elevated status at runtime. Configured seeds are not persisted.
 */
public enum ElevationOrigin {
    CLUSTER,
    MANUAL
}
