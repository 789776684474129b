package com.nexus.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DailyReport {
    private LocalDate day;
    private int trades;
    private int wins;
    private int losses;
    private BigDecimal realizedPnl;
    private int consecutiveLosses;
    // ISO-8601 UTC, null when no cooldown has been set today
    private String cooldownUntil;
}
