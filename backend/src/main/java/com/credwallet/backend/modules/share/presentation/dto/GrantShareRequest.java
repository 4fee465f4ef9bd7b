package com.credwallet.backend.modules.share.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record GrantShareRequest(
        @NotNull(message = "granteeId is required")
        Long granteeId,
        @NotBlank(message = "permission is required")
        String permission,
        OffsetDateTime expiresAt
) {
}
