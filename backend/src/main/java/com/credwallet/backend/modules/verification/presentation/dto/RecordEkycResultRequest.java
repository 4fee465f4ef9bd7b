package com.credwallet.backend.modules.verification.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.NotBlank;

public record RecordEkycResultRequest(
        @NotBlank(message = "status is required")
        String status,
        String referenceId,
        Map<String, Object> result
) {
}
