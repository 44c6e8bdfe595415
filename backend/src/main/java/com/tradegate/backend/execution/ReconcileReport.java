package com.tradegate.backend.execution;

import java.time.Instant;
import java.util.List;

public record ReconcileReport(boolean consistent, List<Mismatch> mismatches, Instant checkedAt, String error) {

    public record Mismatch(String symbol, int localQuantity, int brokerQuantity) {
    }
}
