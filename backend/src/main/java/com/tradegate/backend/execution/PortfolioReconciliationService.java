package com.tradegate.backend.execution;

import com.tradegate.backend.broker.BrokerCallGuard;
import com.tradegate.backend.broker.BrokerPort;
import com.tradegate.backend.broker.BrokerResult;
import com.tradegate.backend.model.Position;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares net quantities in the local portfolio mirror with the positions the broker reports.
 * Reporting only; nothing is corrected automatically.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioReconciliationService {

    private final BrokerPort brokerPort;
    private final BrokerCallGuard brokerCallGuard;
    private final TradingSessionService tradingSessionService;
    private final Clock clock;

    @Value("${trading.reconcile.qty-tolerance:0}")
    private int qtyTolerance;

    public ReconcileReport reconcile() {
        PortfolioSnapshot local = tradingSessionService.portfolio().snapshot();
        BrokerResult<List<Position>> positions = brokerCallGuard.call("positions", brokerPort::getPositions);
        if (!positions.isSuccess()) {
            log.warn("Reconciliation skipped: {}", positions.message());
            return new ReconcileReport(false, List.of(), clock.instant(), positions.message());
        }
        return compare(local, positions.value());
    }

    ReconcileReport compare(PortfolioSnapshot local, List<Position> brokerPositions) {
        Map<String, Integer> brokerBySymbol = brokerPositions.stream()
                .filter(position -> position.symbol() != null)
                .collect(Collectors.toMap(Position::symbol, Position::quantity, Integer::sum));
        Set<String> symbols = new LinkedHashSet<>(local.positions().keySet());
        symbols.addAll(brokerBySymbol.keySet());

        List<ReconcileReport.Mismatch> mismatches = new ArrayList<>();
        for (String symbol : symbols) {
            PortfolioSnapshot.HoldingView view = local.positions().get(symbol);
            int localQty = view == null ? 0 : view.longQuantity() - view.shortQuantity();
            int brokerQty = brokerBySymbol.getOrDefault(symbol, 0);
            if (Math.abs(localQty - brokerQty) > qtyTolerance) {
                mismatches.add(new ReconcileReport.Mismatch(symbol, localQty, brokerQty));
            }
        }
        if (!mismatches.isEmpty()) {
            log.warn("Portfolio mismatch on {} symbol(s): {}", mismatches.size(), mismatches);
        }
        return new ReconcileReport(mismatches.isEmpty(), List.copyOf(mismatches), clock.instant(), null);
    }
}
