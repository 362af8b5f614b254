package com.whaleradar.domain;

public enum ClusterDirection {
    LONG,
    SHORT
}
