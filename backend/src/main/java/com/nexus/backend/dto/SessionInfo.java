package com.nexus.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexus.backend.model.TradingSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionInfo {
    private TradingSession name;
    private String liquidity;
    private double riskMultiplier;
    private String note;

    public static SessionInfo from(TradingSession session) {
        return SessionInfo.builder()
                .name(session)
                .liquidity(session.getLiquidity())
                .riskMultiplier(session.getRiskMultiplier())
                .note(session.getNote())
                .build();
    }
}
