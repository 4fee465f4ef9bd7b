package com.credwallet.backend.modules.credential.presentation.dto;

import java.time.OffsetDateTime;

public record CredentialSummaryResponse(
        Long id,
        Long ownerId,
        String title,
        String description,
        boolean owned,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
