package com.nexus.backend.service.regime;

import com.nexus.backend.model.MarketRegime;
import com.nexus.backend.model.VolatilityState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Combines per-timeframe classifications by majority vote. Confidence grows
 * with agreement between timeframes and with slope strength.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MultiTimeframeRegimeService {

    private static final double SLOPE_SCALE = 0.002;

    private final RegimeService regimeService;

    public record MultiTimeframeRegime(MarketRegime regime,
                                       VolatilityState volatilityState,
                                       double confidence,
                                       Map<String, RegimeService.RegimeResult> perTimeframe) {

        public String describe() {
            if (regime == MarketRegime.UNKNOWN) {
                return "unknown";
            }
            return String.format(Locale.ROOT, "%s (conf %.2f)", regime.name().toLowerCase(Locale.ROOT), confidence);
        }
    }

    public MultiTimeframeRegime evaluate(Map<String, List<Double>> closesByTimeframe) {
        Map<String, RegimeService.RegimeResult> perTimeframe = new LinkedHashMap<>();
        if (closesByTimeframe != null) {
            closesByTimeframe.forEach((timeframe, closes) -> {
                RegimeService.RegimeResult result = regimeService.classify(closes);
                if (result.regime() != MarketRegime.UNKNOWN) {
                    perTimeframe.put(timeframe, result);
                }
            });
        }
        return combine(perTimeframe);
    }

    public MultiTimeframeRegime combine(Map<String, RegimeService.RegimeResult> perTimeframe) {
        if (perTimeframe.isEmpty()) {
            return new MultiTimeframeRegime(MarketRegime.UNKNOWN, VolatilityState.UNKNOWN, 0.0, perTimeframe);
        }
        int total = perTimeframe.size();
        long trendVotes = perTimeframe.values().stream().filter(r -> r.regime() == MarketRegime.TREND).count();
        long rangeVotes = total - trendVotes;
        MarketRegime regime = trendVotes > rangeVotes ? MarketRegime.TREND : MarketRegime.RANGE;

        long highVotes = perTimeframe.values().stream()
                .filter(r -> r.volatilityState() == VolatilityState.HIGH)
                .count();
        VolatilityState volatility = highVotes * 2 > total ? VolatilityState.HIGH : VolatilityState.LOW;

        double regimeAgreement = (double) Math.max(trendVotes, rangeVotes) / total;
        double volAgreement = (double) (volatility == VolatilityState.HIGH ? highVotes : total - highVotes) / total;
        double meanSlope = perTimeframe.values().stream().mapToDouble(r -> Math.abs(r.slope())).average().orElse(0.0);
        double slopeBonus = clip(meanSlope / SLOPE_SCALE);

        double confidence = clip(0.55 * regimeAgreement + 0.25 * volAgreement + 0.20 * slopeBonus);
        log.debug("Regime vote trend={} range={} highVol={} confidence={}", trendVotes, rangeVotes, highVotes, confidence);
        return new MultiTimeframeRegime(regime, volatility, confidence, perTimeframe);
    }

    private static double clip(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
