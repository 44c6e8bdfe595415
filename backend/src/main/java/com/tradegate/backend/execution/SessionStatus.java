package com.tradegate.backend.execution;

import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.risk.RiskSummary;

import java.util.List;

public record SessionStatus(
        boolean ready,
        String message,
        boolean dryRun,
        String broker,
        AccountInfo account,
        List<Position> positions,
        ExecutionReport execution,
        RiskSummary risk
) {
}
