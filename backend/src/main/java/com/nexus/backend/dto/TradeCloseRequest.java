package com.nexus.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
public class TradeCloseRequest {

    @NotBlank
    @Size(max = 36)
    private String userId;

    @NotBlank
    @Size(max = 36)
    private String tradeId;

    @NotNull
    @Positive
    private Double exitPrice;

    // Signed: losses are negative
    @NotNull
    private Double pnl;

    private Double rr;

    private boolean ruleViolation;

    @Size(max = 1000)
    private String notes;
}
