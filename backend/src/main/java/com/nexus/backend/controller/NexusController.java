package com.nexus.backend.controller;

import com.nexus.backend.dto.CheckTradeRequest;
import com.nexus.backend.dto.CheckTradeResponse;
import com.nexus.backend.service.TradeRiskEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/nexus")
@RequiredArgsConstructor
@Tag(name = "Nexus")
public class NexusController {

    private final TradeRiskEngine tradeRiskEngine;

    @PostMapping("/check-trade")
    @Operation(summary = "Validate a proposed trade against risk and discipline limits")
    public ResponseEntity<CheckTradeResponse> checkTrade(@Valid @RequestBody CheckTradeRequest request) {
        log.info("Check-trade requested. user={} symbol={} risk={}%", request.getUserId(), request.getSymbol(),
                request.getIntendedRiskPct());
        return ResponseEntity.ok(tradeRiskEngine.checkTrade(request));
    }
}
