package com.nexus.backend.service.regime;

import com.nexus.backend.config.NexusProperties;
import com.nexus.backend.model.MarketRegime;
import com.nexus.backend.model.VolatilityState;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MultiTimeframeRegimeServiceTest {

    private final MultiTimeframeRegimeService service =
            new MultiTimeframeRegimeService(new RegimeService(new NexusProperties()));

    @Test
    void majorityVoteDecidesRegimeAndVolatility() {
        Map<String, RegimeService.RegimeResult> perTf = new LinkedHashMap<>();
        perTf.put("1m", new RegimeService.RegimeResult(MarketRegime.TREND, VolatilityState.HIGH, 0.002, 0.01));
        perTf.put("5m", new RegimeService.RegimeResult(MarketRegime.TREND, VolatilityState.HIGH, 0.002, 0.01));
        perTf.put("15m", new RegimeService.RegimeResult(MarketRegime.RANGE, VolatilityState.LOW, 0.002, 0.01));

        MultiTimeframeRegimeService.MultiTimeframeRegime combined = service.combine(perTf);

        assertThat(combined.regime()).isEqualTo(MarketRegime.TREND);
        assertThat(combined.volatilityState()).isEqualTo(VolatilityState.HIGH);
        // 0.55 * 2/3 + 0.25 * 2/3 + 0.20 * 1.0
        assertThat(combined.confidence()).isCloseTo(0.7333, within(1e-3));
        assertThat(combined.describe()).isEqualTo("trend (conf 0.73)");
    }

    @Test
    void tieFallsBackToRange() {
        Map<String, RegimeService.RegimeResult> perTf = new LinkedHashMap<>();
        perTf.put("1m", new RegimeService.RegimeResult(MarketRegime.TREND, VolatilityState.LOW, 0.0, 0.0));
        perTf.put("5m", new RegimeService.RegimeResult(MarketRegime.RANGE, VolatilityState.LOW, 0.0, 0.0));

        MultiTimeframeRegimeService.MultiTimeframeRegime combined = service.combine(perTf);

        assertThat(combined.regime()).isEqualTo(MarketRegime.RANGE);
        assertThat(combined.volatilityState()).isEqualTo(VolatilityState.LOW);
        assertThat(combined.confidence()).isCloseTo(0.525, within(1e-9));
    }

    @Test
    void noCandlesMeansUnknown() {
        MultiTimeframeRegimeService.MultiTimeframeRegime combined = service.evaluate(null);

        assertThat(combined.regime()).isEqualTo(MarketRegime.UNKNOWN);
        assertThat(combined.volatilityState()).isEqualTo(VolatilityState.UNKNOWN);
        assertThat(combined.describe()).isEqualTo("unknown");
    }
}
