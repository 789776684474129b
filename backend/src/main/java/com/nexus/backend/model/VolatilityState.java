package com.nexus.backend.model;

public enum VolatilityState {
    HIGH,
    LOW,
    UNKNOWN
}
