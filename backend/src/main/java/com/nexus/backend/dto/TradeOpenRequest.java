package com.nexus.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexus.backend.model.TradingMode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradeOpenRequest {

    @NotBlank
    @Size(max = 36)
    private String userId;

    @NotBlank
    @Size(max = 32)
    @Schema(example = "BTCUSDT")
    private String symbol;

    @Size(max = 64)
    @Schema(example = "mean_reversion")
    private String strategy;

    @NotNull
    @Positive
    private Double entryPrice;

    @NotNull
    @Positive
    private Double qty;

    @NotNull
    @Positive
    private Double riskPct;

    @NotNull
    @Positive
    private Double stopDistancePct;

    @Builder.Default
    private TradingMode mode = TradingMode.PAPER;

    @Size(max = 1000)
    private String notes;
}
