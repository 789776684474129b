package com.nexus.backend.model;

/**
 * UTC liquidity buckets and the risk multiplier applied to trades taken in them.
 */
public enum TradingSession {
    ASIA("low", 0.7, "Lower volatility, prone to fake moves."),
    EU("medium", 0.9, "Trend formation and structure building."),
    US("high", 1.0, "Highest liquidity and strongest moves."),
    OFF_HOURS("very low", 0.5, "Thin books after the US close. Avoid trading unless exceptional setup."),
    WEEKEND("very low", 0.5, "Avoid trading unless exceptional setup.");

    private final String liquidity;
    private final double riskMultiplier;
    private final String note;

    TradingSession(String liquidity, double riskMultiplier, String note) {
        this.liquidity = liquidity;
        this.riskMultiplier = riskMultiplier;
        this.note = note;
    }

    public String getLiquidity() {
        return liquidity;
    }

    public double getRiskMultiplier() {
        return riskMultiplier;
    }

    public String getNote() {
        return note;
    }
}
