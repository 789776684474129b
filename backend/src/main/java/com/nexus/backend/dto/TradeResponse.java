package com.nexus.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexus.backend.model.Trade;
import com.nexus.backend.model.TradingMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradeResponse {

    private String id;
    private String userId;
    private String symbol;
    private String strategy;
    private TradingMode mode;
    private Trade.TradeStatus status;
    private LocalDateTime openedAt;
    private LocalDateTime closedAt;
    private Double entryPrice;
    private Double exitPrice;
    private Double qty;
    private Double riskPct;
    private Double stopDistancePct;
    private Double pnl;
    private Double rr;
    private boolean ruleViolation;
    private String notes;

    public static TradeResponse from(Trade trade) {
        return TradeResponse.builder()
                .id(trade.getId())
                .userId(trade.getUserId())
                .symbol(trade.getSymbol())
                .strategy(trade.getStrategy())
                .mode(trade.getMode())
                .status(trade.getStatus())
                .openedAt(trade.getOpenedAt())
                .closedAt(trade.getClosedAt())
                .entryPrice(trade.getEntryPrice())
                .exitPrice(trade.getExitPrice())
                .qty(trade.getQty())
                .riskPct(trade.getRiskPct())
                .stopDistancePct(trade.getStopDistancePct())
                .pnl(trade.getPnl())
                .rr(trade.getRr())
                .ruleViolation(trade.isRuleViolation())
                .notes(trade.getNotes())
                .build();
    }
}
