package com.tradegate.backend.controller;

import com.tradegate.backend.risk.RiskManager;
import com.tradegate.backend.risk.RiskSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@Tag(name = "Risk")
public class RiskController {

    private final RiskManager riskManager;

    @GetMapping("/summary")
    @Operation(summary = "Risk limits, counters and recent risk events")
    public ResponseEntity<RiskSummary> summary() {
        return ResponseEntity.ok(riskManager.getRiskSummary());
    }

    @PostMapping("/circuit-breaker/reset")
    @Operation(summary = "Manually clear the circuit breaker")
    public ResponseEntity<RiskSummary> resetCircuitBreaker() {
        log.warn("Circuit breaker reset requested via API");
        riskManager.resetCircuitBreaker();
        return ResponseEntity.ok(riskManager.getRiskSummary());
    }
}
