package com.credwallet.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;

public record EkycSessionResponse(
        Long id,
        Long userId,
        String status,
        String provider,
        String referenceId,
        Map<String, Object> result,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
