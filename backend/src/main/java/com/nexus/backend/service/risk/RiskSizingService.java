package com.nexus.backend.service.risk;

import com.nexus.backend.config.NexusProperties;
import com.nexus.backend.model.TradingSession;
import com.nexus.backend.model.VolatilityState;
import com.nexus.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-trade risk policy.
 * <ul>
 *   <li>requested risk amount = equity x intended risk % / 100</li>
 *   <li>risk % is capped at {@code nexus.risk.max-risk-per-trade-pct}</li>
 *   <li>high volatility lowers the cap to {@code nexus.risk.high-volatility-risk-pct}</li>
 *   <li>the session multiplier scales whatever is left</li>
 *   <li>position size = equity x risk % / stop distance %, with the stop floored at
 *   {@code nexus.risk.min-stop-distance-pct}</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
public class RiskSizingService {

    private final NexusProperties nexusProperties;

    public record RiskResult(double requestedRiskAmount,
                             double finalRiskPct,
                             double finalRiskAmount,
                             double positionSizeUsd,
                             List<String> reasons) {}

    public RiskResult compute(double accountEquity,
                              double intendedRiskPct,
                              double stopDistancePct,
                              VolatilityState volatilityState,
                              TradingSession session) {
        NexusProperties.Risk cfg = nexusProperties.getRisk();
        List<String> reasons = new ArrayList<>();

        double requestedRiskAmount = MoneyUtils.percentOf(accountEquity, intendedRiskPct);

        double riskPct = Math.min(intendedRiskPct, cfg.getMaxRiskPerTradePct());
        if (intendedRiskPct > cfg.getMaxRiskPerTradePct()) {
            reasons.add(String.format("Risk %.2f exceeds cap of %.2f (%.2f%% of equity); capped.",
                    requestedRiskAmount, MoneyUtils.percentOf(accountEquity, cfg.getMaxRiskPerTradePct()),
                    cfg.getMaxRiskPerTradePct()));
        }

        if (volatilityState == VolatilityState.HIGH && riskPct > cfg.getHighVolatilityRiskPct()) {
            riskPct = cfg.getHighVolatilityRiskPct();
            reasons.add(String.format("High volatility detected; risk reduced to %.2f%%.", riskPct));
        }

        if (session != null && session.getRiskMultiplier() < 1.0) {
            riskPct = riskPct * session.getRiskMultiplier();
            reasons.add(String.format("%s session (%s liquidity); risk scaled by %.2f.",
                    session.name(), session.getLiquidity(), session.getRiskMultiplier()));
        }

        double stop = Math.max(stopDistancePct, cfg.getMinStopDistancePct());
        double positionSize = accountEquity * (riskPct / 100.0) / (stop / 100.0);

        return new RiskResult(
                requestedRiskAmount,
                MoneyUtils.round(riskPct),
                MoneyUtils.percentOf(accountEquity, riskPct),
                MoneyUtils.round(positionSize),
                reasons);
    }
}
