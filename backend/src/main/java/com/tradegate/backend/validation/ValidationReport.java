package com.tradegate.backend.validation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationReport(Summary summary, List<ValidationResult> results, List<String> recommendations) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Summary(int totalTests, int passed, int failed, double successRate, Instant timestamp) {
    }

    public boolean allPassed() {
        return summary.failed() == 0;
    }
}
