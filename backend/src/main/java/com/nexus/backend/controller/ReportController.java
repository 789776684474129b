package com.nexus.backend.controller;

import com.nexus.backend.dto.DailyReport;
import com.nexus.backend.dto.WeeklyReport;
import com.nexus.backend.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Tag(name = "Reports")
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/daily")
    @Operation(summary = "Today's trading tally (UTC)")
    public ResponseEntity<DailyReport> daily(@RequestParam("user_id") String userId) {
        return ResponseEntity.ok(reportService.daily(userId));
    }

    @GetMapping("/weekly")
    @Operation(summary = "Tally over the last seven UTC days")
    public ResponseEntity<WeeklyReport> weekly(@RequestParam("user_id") String userId) {
        return ResponseEntity.ok(reportService.weekly(userId));
    }
}
