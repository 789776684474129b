package com.nexus.backend.service;

import com.nexus.backend.dto.DailyReport;
import com.nexus.backend.dto.WeeklyReport;
import com.nexus.backend.exception.ValidationException;
import com.nexus.backend.model.DailyStat;
import com.nexus.backend.repository.DailyStatRepository;
import com.nexus.backend.util.MoneyUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 10);

    @Mock
    private BehaviorGuardService behaviorGuardService;

    @Mock
    private DailyStatRepository dailyStatRepository;

    @InjectMocks
    private ReportService reportService;

    @Test
    void dailyReportsTodaysRow() {
        DailyStat today = stat(DAY, 3, 1, 2, "-15.5", 2);
        today.setCooldownUntil(LocalDateTime.of(2024, 1, 10, 9, 30));
        when(behaviorGuardService.getOrCreateDaily("u-1", DAY)).thenReturn(today);

        DailyReport report = reportService.daily("u-1", DAY);

        assertThat(report.getDay()).isEqualTo(DAY);
        assertThat(report.getTrades()).isEqualTo(3);
        assertThat(report.getRealizedPnl()).isEqualByComparingTo("-15.5");
        assertThat(report.getConsecutiveLosses()).isEqualTo(2);
        assertThat(report.getCooldownUntil()).isEqualTo("2024-01-10T09:30Z");
    }

    @Test
    void weeklySumsSevenDays() {
        LocalDate start = DAY.minusDays(6);
        when(dailyStatRepository.findByUserIdAndTradeDayBetweenOrderByTradeDayAsc("u-1", start, DAY)).thenReturn(List.of(
                stat(start, 2, 2, 0, "40", 0),
                stat(DAY.minusDays(2), 3, 0, 3, "-30", 3),
                stat(DAY, 1, 1, 0, "12.25", 0)));

        WeeklyReport report = reportService.weekly("u-1", DAY);

        assertThat(report.getStartDay()).isEqualTo(start);
        assertThat(report.getEndDay()).isEqualTo(DAY);
        assertThat(report.getTrades()).isEqualTo(6);
        assertThat(report.getWins()).isEqualTo(3);
        assertThat(report.getLosses()).isEqualTo(3);
        assertThat(report.getRealizedPnl()).isEqualByComparingTo("22.25");
        assertThat(report.getMaxConsecutiveLosses()).isEqualTo(3);
    }

    @Test
    void weeklyWithoutActivityIsZero() {
        when(dailyStatRepository.findByUserIdAndTradeDayBetweenOrderByTradeDayAsc("u-1", DAY.minusDays(6), DAY))
                .thenReturn(List.of());

        WeeklyReport report = reportService.weekly("u-1", DAY);

        assertThat(report.getTrades()).isZero();
        assertThat(report.getRealizedPnl()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void blankUserIsRejected() {
        assertThatThrownBy(() -> reportService.daily(" ", DAY)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> reportService.weekly(null, DAY)).isInstanceOf(ValidationException.class);
    }

    @Test
    void overlongUserIsRejected() {
        assertThatThrownBy(() -> reportService.daily("x".repeat(40), DAY))
                .isInstanceOf(ValidationException.class)
                .hasMessage("user_id must be at most 36 characters.");
    }

    private static DailyStat stat(LocalDate day, int trades, int wins, int losses, String pnl, int streak) {
        return DailyStat.builder()
                .userId("u-1")
                .tradeDay(day)
                .tradesCount(trades)
                .wins(wins)
                .losses(losses)
                .realizedPnl(MoneyUtils.scale(new BigDecimal(pnl)))
                .consecutiveLosses(streak)
                .build();
    }
}
