package com.tradegate.backend.validation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationResult(
        String testName,
        boolean passed,
        String message,
        Map<String, Object> details,
        Instant timestamp
) {
}
