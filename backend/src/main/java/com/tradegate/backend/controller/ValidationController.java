package com.tradegate.backend.controller;

import com.tradegate.backend.validation.TradingSystemValidator;
import com.tradegate.backend.validation.ValidationReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/validation")
@RequiredArgsConstructor
@Tag(name = "Validation")
public class ValidationController {

    private final TradingSystemValidator validator;

    @PostMapping("/run")
    @Operation(summary = "Run the full validation suite")
    public ResponseEntity<ValidationReport> run() {
        return ResponseEntity.ok(validator.runFullValidation());
    }

    @GetMapping("/quick")
    @Operation(summary = "Configuration and connectivity check")
    public ResponseEntity<Map<String, Boolean>> quick() {
        return ResponseEntity.ok(Map.of("passed", validator.runQuickValidation()));
    }
}
