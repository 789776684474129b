package com.nexus.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckTradeRequest {

    @NotBlank
    @Size(max = 36)
    private String userId;

    @NotBlank
    @Schema(example = "BTCUSDT")
    private String symbol;

    @Schema(example = "breakout")
    private String strategy;

    @NotNull
    @Positive
    @Schema(description = "Paper account equity in quote currency", example = "1000")
    private Double accountEquity;

    @NotNull
    @Positive
    @DecimalMax("100.0")
    @Schema(description = "Requested risk % per trade", example = "1.0")
    private Double intendedRiskPct;

    @NotNull
    @Positive
    @Schema(description = "Stop distance as % of entry price", example = "0.5")
    private Double stopDistancePct;

    @Builder.Default
    @Schema(example = "1m")
    private String timeframe = "1m";

    @Schema(description = "Optional recent close prices keyed by timeframe, oldest first")
    private Map<String, List<Double>> candles;
}
