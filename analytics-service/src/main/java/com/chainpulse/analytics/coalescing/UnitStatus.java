package com.chainpulse.analytics.coalescing;

public enum UnitStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
