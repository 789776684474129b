package com.nexus.backend.model;

public enum MarketRegime {
    TREND,
    RANGE,
    UNKNOWN
}
