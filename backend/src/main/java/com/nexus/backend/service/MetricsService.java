package com.nexus.backend.service;

import com.nexus.backend.model.TradeDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void recordCheck(TradeDecision decision) {
        Counter.builder("nexus_trade_checks_total")
                .tag("decision", decision.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordTradeOpened(String mode) {
        Counter.builder("nexus_trades_opened_total")
                .tag("mode", mode)
                .register(meterRegistry)
                .increment();
    }

    public void recordTradeClosed(boolean ruleViolation) {
        Counter.builder("nexus_trades_closed_total")
                .tag("rule_violation", String.valueOf(ruleViolation))
                .register(meterRegistry)
                .increment();
    }
}
