package com.nexus.backend.controller;

import com.nexus.backend.repository.DailyStatRepository;
import com.nexus.backend.repository.TradeRepository;
import com.nexus.backend.service.BehaviorGuardService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class NexusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TradeRepository tradeRepository;

    @Autowired
    private DailyStatRepository dailyStatRepository;

    @Autowired
    private BehaviorGuardService behaviorGuardService;

    @BeforeEach
    void setup() {
        tradeRepository.deleteAll();
        dailyStatRepository.deleteAll();
    }

    @Test
    void checkTradeReturnsRiskAmount() throws Exception {
        mockMvc.perform(post("/api/nexus/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("trader-1", 1000, 1.0)))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.allowed").value(true))
                .andExpect(jsonPath("$.decision").value("ALLOW"))
                .andExpect(jsonPath("$.risk_amount").value(10.0))
                .andExpect(jsonPath("$.market_regime").value("unknown"))
                .andExpect(jsonPath("$.session").exists());
    }

    @Test
    void nonPositiveEquityIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/nexus/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("trader-1", 0, 1.0)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("accountEquity"));
    }

    @Test
    void riskAboveHundredPercentIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/nexus/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("trader-1", 1000, 120.0)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void overlongUserIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/nexus/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("u".repeat(40), 1000, 1.0)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("userId"));
    }

    @Test
    void nullCandleCloseIsBadRequest() throws Exception {
        String body = """
                {
                  "user_id": "trader-1",
                  "symbol": "BTCUSDT",
                  "account_equity": 1000,
                  "intended_risk_pct": 1.0,
                  "stop_distance_pct": 0.5,
                  "candles": {"1m": [100, null, 101]}
                }
                """;

        mockMvc.perform(post("/api/nexus/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("candles"));
    }

    @Test
    void astronomicalEquityIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/nexus/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("trader-1", 1e308, 50.0)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("account_equity"));
    }

    @Test
    void lossStreakBlocksFurtherTrades() throws Exception {
        Instant now = Instant.now();
        behaviorGuardService.onTradeClosed("trader-2", -10, now);
        behaviorGuardService.onTradeClosed("trader-2", -10, now);

        mockMvc.perform(post("/api/nexus/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("trader-2", 1000, 1.0)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.decision").value("BLOCK"))
                .andExpect(jsonPath("$.reason", startsWith("Cooldown active until")));

        mockMvc.perform(post("/api/nexus/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("trader-3", 1000, 1.0)))
                .andExpect(jsonPath("$.allowed").value(true));
    }

    private static String payload(String userId, double equity, double riskPct) {
        return """
                {
                  "user_id": "%s",
                  "symbol": "BTCUSDT",
                  "strategy": "breakout",
                  "account_equity": %s,
                  "intended_risk_pct": %s,
                  "stop_distance_pct": 0.5
                }
                """.formatted(userId, equity, riskPct);
    }
}
