package com.nexus.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum TradingMode {
    PAPER,
    LIVE;

    // Case-insensitive; a missing mode means PAPER
    @JsonCreator
    public static TradingMode fromRequest(String value) {
        if (value == null || value.isBlank()) {
            return PAPER;
        }
        return TradingMode.valueOf(value.trim().toUpperCase());
    }
}
