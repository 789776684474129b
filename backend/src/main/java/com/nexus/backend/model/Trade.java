package com.nexus.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Journal entry for a single position. Opened once, closed once, never deleted.
 */
@Entity
@Table(name = "trades", indexes = {
        @Index(name = "ix_trades_user_opened", columnList = "user_id, opened_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uq_trades_user_open_symbol", columnNames = {"user_id", "open_symbol"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 36)
    private String userId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(nullable = false, length = 64)
    private String strategy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TradingMode mode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TradeStatus status;

    // Mirrors symbol while OPEN, null once CLOSED; unique per user
    @Column(length = 32)
    private String openSymbol;

    @Column(nullable = false)
    private LocalDateTime openedAt;

    private LocalDateTime closedAt;

    @Column(nullable = false)
    private Double entryPrice;

    private Double exitPrice;

    @Column(nullable = false)
    private Double qty;

    @Column(nullable = false)
    private Double riskPct;

    @Column(nullable = false)
    private Double stopDistancePct;

    // Realized PnL in quote currency
    private Double pnl;

    // Reward/risk multiple
    private Double rr;

    @Column(nullable = false)
    private boolean ruleViolation;

    @Column(length = 4000)
    private String notes;

    @Version
    private Long version;

    public boolean isOpen() {
        return status == TradeStatus.OPEN;
    }

    public enum TradeStatus { OPEN, CLOSED }
}
