package com.nexus.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexus.backend.model.TradeDecision;
import com.nexus.backend.model.TradingSession;
import com.nexus.backend.model.VolatilityState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckTradeResponse {

    private boolean allowed;
    private String reason;
    private TradeDecision decision;
    private double qualityScore;
    private double riskPct;
    private double riskAmount;
    private double finalRiskAmount;
    private double positionSizeUsd;
    private List<String> reasons;
    private List<String> suggestedActions;
    private String marketRegime;
    private VolatilityState volatilityState;
    private TradingSession session;
}
