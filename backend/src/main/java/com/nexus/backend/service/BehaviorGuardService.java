package com.nexus.backend.service;

import com.nexus.backend.config.NexusProperties;
import com.nexus.backend.model.DailyStat;
import com.nexus.backend.repository.DailyStatRepository;
import com.nexus.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Discipline guardrails: a daily trade cap and a cooldown after a streak of
 * losing closes. State lives in one {@link DailyStat} row per user and UTC day.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BehaviorGuardService {

    private final NexusProperties nexusProperties;
    private final DailyStatRepository dailyStatRepository;

    public record GuardDecision(boolean allowed, List<String> reasons, List<String> suggestedActions,
                                LocalDateTime cooldownUntil) {

        static GuardDecision allow() {
            return new GuardDecision(true, List.of(), List.of(), null);
        }
    }

    @Transactional
    public GuardDecision check(String userId, Instant nowUtc) {
        LocalDateTime now = LocalDateTime.ofInstant(nowUtc, ZoneOffset.UTC);
        DailyStat stat = getOrCreateDaily(userId, now.toLocalDate());
        NexusProperties.Behavior cfg = nexusProperties.getBehavior();

        LocalDateTime cooldownUntil = activeCooldown(userId, stat, now);
        if (cooldownUntil != null) {
            log.info("Cooldown active for user {} until {}", userId, cooldownUntil);
            return new GuardDecision(false,
                    List.of("Cooldown active until " + cooldownUntil + "Z."),
                    List.of("Wait out the cooldown. Review your last losing trades."),
                    cooldownUntil);
        }
        if (stat.getTradesCount() >= cfg.getMaxTradesPerDay()) {
            log.info("Daily trade cap reached for user {} ({}/{})", userId, stat.getTradesCount(), cfg.getMaxTradesPerDay());
            return new GuardDecision(false,
                    List.of(String.format("Max trades/day reached (%d/%d).", stat.getTradesCount(), cfg.getMaxTradesPerDay())),
                    List.of("Stop trading for today. Review performance."),
                    null);
        }
        return GuardDecision.allow();
    }

    @Transactional
    public DailyStat onTradeClosed(String userId, double pnl, Instant closedAtUtc) {
        LocalDateTime closedAt = LocalDateTime.ofInstant(closedAtUtc, ZoneOffset.UTC);
        DailyStat stat = getOrCreateDaily(userId, closedAt.toLocalDate());
        NexusProperties.Behavior cfg = nexusProperties.getBehavior();

        stat.setTradesCount(stat.getTradesCount() + 1);
        stat.setRealizedPnl(MoneyUtils.add(stat.getRealizedPnl(), MoneyUtils.bd(pnl)));
        if (pnl > 0) {
            stat.setWins(stat.getWins() + 1);
            stat.setConsecutiveLosses(0);
        } else {
            stat.setLosses(stat.getLosses() + 1);
            stat.setConsecutiveLosses(stat.getConsecutiveLosses() + 1);
        }

        if (stat.getConsecutiveLosses() >= cfg.getMaxConsecutiveLosses()) {
            stat.setCooldownUntil(closedAt.plusMinutes(cfg.getCooldownMinutes()));
            log.warn("User {} hit {} consecutive losses; cooldown until {}", userId,
                    stat.getConsecutiveLosses(), stat.getCooldownUntil());
        }
        return dailyStatRepository.saveAndFlush(stat);
    }

    @Transactional
    public DailyStat getOrCreateDaily(String userId, LocalDate day) {
        return dailyStatRepository.findByUserIdAndTradeDay(userId, day)
                .orElseGet(() -> dailyStatRepository.saveAndFlush(DailyStat.builder()
                        .userId(userId)
                        .tradeDay(day)
                        .tradesCount(0)
                        .wins(0)
                        .losses(0)
                        .realizedPnl(MoneyUtils.ZERO)
                        .consecutiveLosses(0)
                        .build()));
    }

    // A cooldown set late in the day can run past midnight UTC
    private LocalDateTime activeCooldown(String userId, DailyStat today, LocalDateTime now) {
        LocalDateTime until = today.getCooldownUntil();
        if (until == null || !now.isBefore(until)) {
            until = dailyStatRepository.findByUserIdAndTradeDay(userId, today.getTradeDay().minusDays(1))
                    .map(DailyStat::getCooldownUntil)
                    .orElse(null);
        }
        return until != null && now.isBefore(until) ? until : null;
    }
}
