package com.nexus.backend.model;

public enum TradeDecision {
    ALLOW,
    WARN,
    BLOCK
}
