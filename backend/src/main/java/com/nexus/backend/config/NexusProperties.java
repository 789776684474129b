package com.nexus.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "nexus")
@Data
@Validated
public class NexusProperties {

    @Valid
    private Risk risk = new Risk();
    @Valid
    private Behavior behavior = new Behavior();
    @Valid
    private Regime regime = new Regime();
    @Valid
    private Validation validation = new Validation();
    private Trades trades = new Trades();
    private Cors cors = new Cors();

    @Data
    public static class Risk {
        @Positive
        private double maxRiskPerTradePct = 1.0;

        @Positive
        private double highVolatilityRiskPct = 0.5;

        @Positive
        private double minStopDistancePct = 0.05;
    }

    @Data
    public static class Behavior {
        @Min(1)
        private int maxTradesPerDay = 5;

        @Min(1)
        private int maxConsecutiveLosses = 2;

        @Min(0)
        private long cooldownMinutes = 30;
    }

    @Data
    public static class Regime {
        @Positive
        private double trendSlopeThreshold = 0.0005;

        @Positive
        @DecimalMax("1.0")
        private double highVolPercentile = 0.8;

        @Min(0)
        private double lowConfidenceThreshold = 0.45;
    }

    @Data
    public static class Validation {
        @Positive
        @DecimalMax("100.0")
        private double maxRiskPct = 100.0;

        @Positive
        @DecimalMax("100.0")
        private double maxStopDistancePct = 100.0;

        // Upper bound for equity, prices, quantities and pnl
        @Positive
        private double maxAmount = 1_000_000_000_000.0;
    }

    @Data
    public static class Trades {
        private boolean liveEnabled = false;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of(
                "http://localhost:3000",
                "http://127.0.0.1:3000"
        ));
        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "OPTIONS"));
    }
}
