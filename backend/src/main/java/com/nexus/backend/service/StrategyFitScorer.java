package com.nexus.backend.service;

import com.nexus.backend.model.MarketRegime;
import com.nexus.backend.model.VolatilityState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how well a strategy label suits the current regime, from 1.0 down to 0.
 */
@Component
public class StrategyFitScorer {

    public record FitScore(double score, List<String> reasons) {}

    public FitScore score(MarketRegime regime, VolatilityState volatility, String strategy) {
        List<String> reasons = new ArrayList<>();
        double score = 1.0;

        if ("breakout".equalsIgnoreCase(strategy) && regime == MarketRegime.RANGE) {
            score -= 0.35;
            reasons.add("Breakout strategy underperforms in range markets.");
        }
        if (volatility == VolatilityState.HIGH) {
            score -= 0.15;
            reasons.add("High volatility increases false signals.");
        }
        if (volatility == VolatilityState.LOW) {
            score -= 0.10;
            reasons.add("Low volatility reduces momentum follow-through.");
        }
        return new FitScore(Math.max(score, 0.0), reasons);
    }
}
