package com.nexus.backend.controller;

import com.nexus.backend.dto.TradeCloseRequest;
import com.nexus.backend.dto.TradeOpenRequest;
import com.nexus.backend.dto.TradeResponse;
import com.nexus.backend.service.TradeRiskEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
@Tag(name = "Trades")
public class TradeController {

    private final TradeRiskEngine tradeRiskEngine;

    @PostMapping("/open")
    @Operation(summary = "Open a journal trade")
    public ResponseEntity<TradeResponse> openTrade(@Valid @RequestBody TradeOpenRequest request) {
        log.info("Open trade requested. user={} symbol={} mode={}", request.getUserId(), request.getSymbol(),
                request.getMode());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(TradeResponse.from(tradeRiskEngine.openTrade(request)));
    }

    @PostMapping("/close")
    @Operation(summary = "Close an open journal trade")
    public ResponseEntity<TradeResponse> closeTrade(@Valid @RequestBody TradeCloseRequest request) {
        log.info("Close trade requested. user={} trade={}", request.getUserId(), request.getTradeId());
        return ResponseEntity.ok(TradeResponse.from(tradeRiskEngine.closeTrade(request)));
    }

    @GetMapping
    @Operation(summary = "List trades opened in the last N days, newest first")
    public ResponseEntity<List<TradeResponse>> listTrades(@RequestParam("user_id") String userId,
                                                          @RequestParam(value = "days", defaultValue = "7") int days) {
        List<TradeResponse> trades = tradeRiskEngine.listTrades(userId, days).stream()
                .map(TradeResponse::from)
                .toList();
        log.info("Retrieved {} trades for user {} over {} days", trades.size(), userId, days);
        return ResponseEntity.ok(trades);
    }
}
