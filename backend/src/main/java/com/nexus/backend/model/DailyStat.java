package com.nexus.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Per-user, per-UTC-day trading tally that drives the behaviour guardrails.
 */
@Entity
@Table(name = "daily_stats", uniqueConstraints = {
        @UniqueConstraint(name = "uq_daily_stats_user_day", columnNames = {"user_id", "trade_day"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String userId;

    @Column(nullable = false)
    private LocalDate tradeDay;

    @Column(nullable = false)
    private int tradesCount;

    @Column(nullable = false)
    private int wins;

    @Column(nullable = false)
    private int losses;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(nullable = false)
    private int consecutiveLosses;

    private LocalDateTime cooldownUntil;

    @Version
    private Long version;
}
