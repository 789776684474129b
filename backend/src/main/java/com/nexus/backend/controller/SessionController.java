package com.nexus.backend.controller;

import com.nexus.backend.dto.SessionInfo;
import com.nexus.backend.service.TradingSessionService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
@Tag(name = "Session")
public class SessionController {

    private final TradingSessionService tradingSessionService;

    @GetMapping
    public ResponseEntity<SessionInfo> current() {
        return ResponseEntity.ok(SessionInfo.from(tradingSessionService.detect(Instant.now())));
    }
}
