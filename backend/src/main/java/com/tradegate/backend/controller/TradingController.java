package com.tradegate.backend.controller;

import com.tradegate.backend.dto.BatchExecutionRequest;
import com.tradegate.backend.exception.BadRequestException;
import com.tradegate.backend.execution.BatchResult;
import com.tradegate.backend.execution.ExecutionReport;
import com.tradegate.backend.execution.PortfolioReconciliationService;
import com.tradegate.backend.execution.PortfolioSnapshot;
import com.tradegate.backend.execution.ReconcileReport;
import com.tradegate.backend.execution.SessionStatus;
import com.tradegate.backend.execution.TradeExecutor;
import com.tradegate.backend.execution.TradingSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/trading")
@RequiredArgsConstructor
@Tag(name = "Trading")
public class TradingController {

    private final TradingSessionService tradingSessionService;
    private final TradeExecutor tradeExecutor;
    private final PortfolioReconciliationService reconciliationService;

    @PostMapping("/decisions")
    @Operation(summary = "Execute a batch of trading decisions")
    public ResponseEntity<BatchResult> execute(@Valid @RequestBody BatchExecutionRequest request) {
        Map<String, BigDecimal> prices = request.getPrices() == null ? Map.of() : request.getPrices();
        requireUsableBatch(request.getDecisions().keySet(), prices);
        log.info("Executing decision batch for {} ticker(s)", request.getDecisions().size());
        return ResponseEntity.ok(tradingSessionService.runBatch(request.getDecisions(), prices));
    }

    @GetMapping("/report")
    @Operation(summary = "Execution report")
    public ResponseEntity<ExecutionReport> report() {
        return ResponseEntity.ok(tradeExecutor.getExecutionReport());
    }

    @GetMapping("/account")
    @Operation(summary = "Account, positions, execution and risk summary")
    public ResponseEntity<SessionStatus> account() {
        return ResponseEntity.ok(tradingSessionService.getAccountSummary());
    }

    @GetMapping("/session")
    @Operation(summary = "Check the session is ready to trade")
    public ResponseEntity<SessionStatus> session() {
        return ResponseEntity.ok(tradingSessionService.validateTradingSession());
    }

    @GetMapping("/portfolio")
    @Operation(summary = "Local portfolio mirror")
    public ResponseEntity<PortfolioSnapshot> portfolio() {
        return ResponseEntity.ok(tradingSessionService.portfolio().snapshot());
    }

    @GetMapping("/reconcile")
    @Operation(summary = "Compare the local portfolio with broker positions")
    public ResponseEntity<ReconcileReport> reconcile() {
        return ResponseEntity.ok(reconciliationService.reconcile());
    }

    private void requireUsableBatch(Set<String> tickers, Map<String, BigDecimal> prices) {
        if (tickers.stream().anyMatch(ticker -> ticker == null || ticker.isBlank())) {
            throw new BadRequestException("Decision tickers must not be blank");
        }
        prices.forEach((ticker, price) -> {
            if (price == null || price.signum() <= 0) {
                throw new BadRequestException("Price for " + ticker + " must be positive");
            }
        });
    }
}
