package com.nexus.backend.service;

import com.nexus.backend.config.NexusProperties;
import com.nexus.backend.dto.CheckTradeRequest;
import com.nexus.backend.dto.CheckTradeResponse;
import com.nexus.backend.dto.TradeCloseRequest;
import com.nexus.backend.dto.TradeOpenRequest;
import com.nexus.backend.exception.DuplicateTradeException;
import com.nexus.backend.exception.NotFoundException;
import com.nexus.backend.exception.ValidationException;
import com.nexus.backend.model.MarketRegime;
import com.nexus.backend.model.Trade;
import com.nexus.backend.model.TradeDecision;
import com.nexus.backend.model.TradingMode;
import com.nexus.backend.model.TradingSession;
import com.nexus.backend.model.VolatilityState;
import com.nexus.backend.repository.TradeRepository;
import com.nexus.backend.service.regime.MultiTimeframeRegimeService;
import com.nexus.backend.service.risk.RiskSizingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pre-trade risk checks and the OPEN -> CLOSED lifecycle of journal trades.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeRiskEngine {

    static final double QUALITY_BLOCK_THRESHOLD = 0.35;
    static final double QUALITY_WARN_THRESHOLD = 0.55;
    static final String DEFAULT_STRATEGY = "unknown";
    static final int MAX_ID_LENGTH = 36;
    static final int MAX_SYMBOL_LENGTH = 32;

    private final NexusProperties nexusProperties;
    private final TradeRepository tradeRepository;
    private final BehaviorGuardService behaviorGuardService;
    private final RiskSizingService riskSizingService;
    private final MultiTimeframeRegimeService regimeService;
    private final TradingSessionService tradingSessionService;
    private final StrategyFitScorer strategyFitScorer;
    private final MetricsService metricsService;

    @Transactional
    public CheckTradeResponse checkTrade(CheckTradeRequest request) {
        return checkTrade(request, Instant.now());
    }

    @Transactional
    public CheckTradeResponse checkTrade(CheckTradeRequest request, Instant nowUtc) {
        requireText("user_id", request.getUserId(), MAX_ID_LENGTH);
        requireText("symbol", request.getSymbol(), MAX_SYMBOL_LENGTH);
        double equity = requireWithin("account_equity", request.getAccountEquity(), maxAmount());
        double intendedRiskPct = requireWithin("intended_risk_pct", request.getIntendedRiskPct(), 100.0);
        double stopDistancePct = requirePositive("stop_distance_pct", request.getStopDistancePct());
        requireValidCandles(request.getCandles());

        TradingSession session = tradingSessionService.detect(nowUtc);
        BehaviorGuardService.GuardDecision guard = behaviorGuardService.check(request.getUserId(), nowUtc);
        MultiTimeframeRegimeService.MultiTimeframeRegime regime = regimeService.evaluate(request.getCandles());
        RiskSizingService.RiskResult risk = riskSizingService.compute(
                equity, intendedRiskPct, stopDistancePct, regime.volatilityState(), session);

        CheckTradeResponse.CheckTradeResponseBuilder response = CheckTradeResponse.builder()
                .riskPct(risk.finalRiskPct())
                .riskAmount(risk.requestedRiskAmount())
                .finalRiskAmount(risk.finalRiskAmount())
                .positionSizeUsd(risk.positionSizeUsd())
                .marketRegime(regime.describe())
                .volatilityState(regime.volatilityState())
                .session(session);

        if (!guard.allowed()) {
            List<String> reasons = concat(guard.reasons(), risk.reasons());
            List<String> suggested = concat(guard.suggestedActions(), List.of("Switch to paper review mode."));
            return finish(request, response, TradeDecision.BLOCK, 0.0, reasons, suggested);
        }

        StrategyFitScorer.FitScore fit = strategyFitScorer.score(
                regime.regime(), regime.volatilityState(), request.getStrategy());
        double quality = fit.score();
        List<String> reasons = concat(fit.reasons(), risk.reasons());
        List<String> suggested = new ArrayList<>();

        if (regime.regime() == MarketRegime.UNKNOWN) {
            reasons.add("No candles supplied; market regime not assessed.");
        } else if (regime.confidence() < nexusProperties.getRegime().getLowConfidenceThreshold()) {
            reasons.add(String.format("Low regime confidence (%.2f); conditions unclear.", regime.confidence()));
            if (quality < QUALITY_WARN_THRESHOLD) {
                return finish(request, response, TradeDecision.BLOCK, quality, reasons,
                        List.of("Wait for clearer market structure.", "Switch timeframe to 15m for confirmation."));
            }
            suggested.add("Proceed only with extra confirmation; consider reducing size.");
        }

        if (quality < QUALITY_BLOCK_THRESHOLD) {
            reasons.add("Trade quality score too low.");
            return finish(request, response, TradeDecision.BLOCK, quality, reasons,
                    List.of("Wait for a clearer setup.", "Consider changing strategy for the current regime."));
        }

        TradeDecision decision = TradeDecision.ALLOW;
        if (quality < QUALITY_WARN_THRESHOLD) {
            decision = TradeDecision.WARN;
            suggested.add("Lower position size or wait for confirmation.");
        }
        if (regime.volatilityState() == VolatilityState.HIGH) {
            suggested.add("Use wider stops or smaller size; expect faster swings.");
        }
        if (suggested.isEmpty()) {
            suggested.add("Proceed only if your setup matches your plan and stop is respected.");
        }
        return finish(request, response, decision, quality, reasons, suggested);
    }

    @Transactional
    public Trade openTrade(TradeOpenRequest request) {
        requireText("user_id", request.getUserId(), MAX_ID_LENGTH);
        requireText("symbol", request.getSymbol(), MAX_SYMBOL_LENGTH);
        NexusProperties.Validation bounds = nexusProperties.getValidation();
        double entryPrice = requireWithin("entry_price", request.getEntryPrice(), bounds.getMaxAmount());
        double qty = requireWithin("qty", request.getQty(), bounds.getMaxAmount());
        double riskPct = requireWithin("risk_pct", request.getRiskPct(), bounds.getMaxRiskPct());
        double stopDistancePct = requireWithin("stop_distance_pct", request.getStopDistancePct(), bounds.getMaxStopDistancePct());

        TradingMode mode = request.getMode() != null ? request.getMode() : TradingMode.PAPER;
        if (mode == TradingMode.LIVE && !nexusProperties.getTrades().isLiveEnabled()) {
            throw new ValidationException("mode", "Only PAPER mode is supported.");
        }

        String symbol = request.getSymbol().trim().toUpperCase();
        if (tradeRepository.existsByUserIdAndSymbolAndStatus(request.getUserId(), symbol, Trade.TradeStatus.OPEN)) {
            log.info("Rejected duplicate open for user {} symbol {}", request.getUserId(), symbol);
            throw new DuplicateTradeException(symbol);
        }

        String strategy = request.getStrategy() == null || request.getStrategy().isBlank()
                ? DEFAULT_STRATEGY
                : request.getStrategy().trim();
        Trade trade = Trade.builder()
                .id(UUID.randomUUID().toString())
                .userId(request.getUserId())
                .symbol(symbol)
                .strategy(strategy)
                .mode(mode)
                .status(Trade.TradeStatus.OPEN)
                .openSymbol(symbol)
                .openedAt(LocalDateTime.now(ZoneOffset.UTC))
                .entryPrice(entryPrice)
                .qty(qty)
                .riskPct(riskPct)
                .stopDistancePct(stopDistancePct)
                .ruleViolation(false)
                .notes(blankToNull(request.getNotes()))
                .build();
        Trade saved;
        try {
            saved = tradeRepository.saveAndFlush(trade);
        } catch (DataIntegrityViolationException ex) {
            // Lost a race with a concurrent open on the same symbol
            log.info("Rejected concurrent duplicate open for user {} symbol {}", request.getUserId(), symbol);
            throw new DuplicateTradeException(symbol, ex);
        }
        metricsService.recordTradeOpened(mode.name());
        log.info("Trade opened. id={} user={} symbol={} qty={} entry={}", saved.getId(), saved.getUserId(),
                saved.getSymbol(), saved.getQty(), saved.getEntryPrice());
        return saved;
    }

    @Transactional
    public Trade closeTrade(TradeCloseRequest request) {
        requireText("user_id", request.getUserId(), MAX_ID_LENGTH);
        requireText("trade_id", request.getTradeId(), MAX_ID_LENGTH);
        double exitPrice = requireWithin("exit_price", request.getExitPrice(), maxAmount());
        if (request.getPnl() == null || !Double.isFinite(request.getPnl())) {
            throw new ValidationException("pnl", "pnl is required.");
        }
        if (Math.abs(request.getPnl()) > maxAmount()) {
            throw new ValidationException("pnl", String.format("pnl must be within +/-%.2f.", maxAmount()));
        }
        if (request.getRr() != null && !Double.isFinite(request.getRr())) {
            throw new ValidationException("rr", "rr must be a finite number.");
        }

        Trade trade = tradeRepository.findByIdAndUserId(request.getTradeId(), request.getUserId())
                .filter(Trade::isOpen)
                .orElseThrow(() -> new NotFoundException("No OPEN trade " + request.getTradeId() + " for this user."));

        Instant closedAt = Instant.now();
        trade.setExitPrice(exitPrice);
        trade.setClosedAt(LocalDateTime.ofInstant(closedAt, ZoneOffset.UTC));
        trade.setStatus(Trade.TradeStatus.CLOSED);
        trade.setOpenSymbol(null);
        trade.setPnl(request.getPnl());
        trade.setRr(request.getRr());
        trade.setRuleViolation(request.isRuleViolation());
        trade.setNotes(appendNotes(trade.getNotes(), request.getNotes()));

        Trade saved;
        try {
            saved = tradeRepository.saveAndFlush(trade);
        } catch (ObjectOptimisticLockingFailureException ex) {
            log.warn("Concurrent close lost for trade {}", trade.getId());
            throw new NotFoundException("No OPEN trade " + request.getTradeId() + " for this user.", ex);
        }

        behaviorGuardService.onTradeClosed(saved.getUserId(), request.getPnl(), closedAt);
        metricsService.recordTradeClosed(saved.isRuleViolation());
        log.info("Trade closed. id={} user={} pnl={} rr={}", saved.getId(), saved.getUserId(), saved.getPnl(), saved.getRr());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Trade> listTrades(String userId, int days) {
        requireText("user_id", userId, MAX_ID_LENGTH);
        if (days <= 0) {
            throw new ValidationException("days", "days must be positive.");
        }
        LocalDateTime since = LocalDateTime.now(ZoneOffset.UTC).minusDays(days);
        return tradeRepository.findByUserIdAndOpenedAtGreaterThanEqualOrderByOpenedAtDesc(userId, since);
    }

    private CheckTradeResponse finish(CheckTradeRequest request,
                                      CheckTradeResponse.CheckTradeResponseBuilder response,
                                      TradeDecision decision,
                                      double quality,
                                      List<String> reasons,
                                      List<String> suggested) {
        metricsService.recordCheck(decision);
        log.info("Trade check user={} symbol={} strategy={} decision={} quality={}", request.getUserId(),
                request.getSymbol(), request.getStrategy(), decision, quality);
        return response
                .allowed(decision != TradeDecision.BLOCK)
                .reason(reasons.isEmpty() ? null : reasons.get(0))
                .decision(decision)
                .qualityScore(quality)
                .reasons(reasons)
                .suggestedActions(suggested)
                .build();
    }

    private static List<String> concat(List<String> first, List<String> second) {
        List<String> out = new ArrayList<>(first);
        out.addAll(second);
        return out;
    }

    private static String appendNotes(String existing, String addition) {
        if (addition == null || addition.isBlank()) {
            return existing;
        }
        if (existing == null || existing.isBlank()) {
            return addition;
        }
        return existing + "\n" + addition;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private double maxAmount() {
        return nexusProperties.getValidation().getMaxAmount();
    }

    private static void requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required.");
        }
        if (value.length() > maxLength) {
            throw new ValidationException(field, field + " must be at most " + maxLength + " characters.");
        }
    }

    private static void requireValidCandles(Map<String, List<Double>> candles) {
        if (candles == null) {
            return;
        }
        candles.forEach((timeframe, closes) -> {
            if (closes == null) {
                return;
            }
            for (Double close : closes) {
                if (close == null || !Double.isFinite(close) || close <= 0) {
                    throw new ValidationException("candles",
                            "candles[" + timeframe + "] must contain positive prices only.");
                }
            }
        });
    }

    private static double requirePositive(String field, Double value) {
        if (value == null || !Double.isFinite(value) || value <= 0) {
            throw new ValidationException(field, field + " must be a positive number.");
        }
        return value;
    }

    private static double requireWithin(String field, Double value, double max) {
        double checked = requirePositive(field, value);
        if (checked > max) {
            throw new ValidationException(field, String.format("%s must not exceed %.2f.", field, max));
        }
        return checked;
    }
}
