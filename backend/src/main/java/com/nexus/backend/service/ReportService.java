package com.nexus.backend.service;

import com.nexus.backend.dto.DailyReport;
import com.nexus.backend.dto.WeeklyReport;
import com.nexus.backend.exception.ValidationException;
import com.nexus.backend.model.DailyStat;
import com.nexus.backend.repository.DailyStatRepository;
import com.nexus.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

@Service
@RequiredArgsConstructor
public class ReportService {

    private static final int WEEK_DAYS = 7;
    private static final int MAX_USER_ID_LENGTH = 36;

    private final BehaviorGuardService behaviorGuardService;
    private final DailyStatRepository dailyStatRepository;

    @Transactional
    public DailyReport daily(String userId) {
        return daily(userId, LocalDate.now(ZoneOffset.UTC));
    }

    @Transactional
    public DailyReport daily(String userId, LocalDate day) {
        requireUser(userId);
        DailyStat stat = behaviorGuardService.getOrCreateDaily(userId, day);
        return DailyReport.builder()
                .day(stat.getTradeDay())
                .trades(stat.getTradesCount())
                .wins(stat.getWins())
                .losses(stat.getLosses())
                .realizedPnl(MoneyUtils.scale(stat.getRealizedPnl()))
                .consecutiveLosses(stat.getConsecutiveLosses())
                .cooldownUntil(stat.getCooldownUntil() != null ? stat.getCooldownUntil() + "Z" : null)
                .build();
    }

    @Transactional(readOnly = true)
    public WeeklyReport weekly(String userId) {
        return weekly(userId, LocalDate.now(ZoneOffset.UTC));
    }

    @Transactional(readOnly = true)
    public WeeklyReport weekly(String userId, LocalDate endDay) {
        requireUser(userId);
        LocalDate startDay = endDay.minusDays(WEEK_DAYS - 1);
        List<DailyStat> rows = dailyStatRepository.findByUserIdAndTradeDayBetweenOrderByTradeDayAsc(userId, startDay, endDay);

        BigDecimal pnl = MoneyUtils.ZERO;
        for (DailyStat row : rows) {
            pnl = MoneyUtils.add(pnl, row.getRealizedPnl());
        }
        return WeeklyReport.builder()
                .startDay(startDay)
                .endDay(endDay)
                .trades(rows.stream().mapToInt(DailyStat::getTradesCount).sum())
                .wins(rows.stream().mapToInt(DailyStat::getWins).sum())
                .losses(rows.stream().mapToInt(DailyStat::getLosses).sum())
                .realizedPnl(pnl)
                .maxConsecutiveLosses(rows.stream().mapToInt(DailyStat::getConsecutiveLosses).max().orElse(0))
                .build();
    }

    private void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("user_id", "user_id is required.");
        }
        if (userId.length() > MAX_USER_ID_LENGTH) {
            throw new ValidationException("user_id", "user_id must be at most " + MAX_USER_ID_LENGTH + " characters.");
        }
    }
}
