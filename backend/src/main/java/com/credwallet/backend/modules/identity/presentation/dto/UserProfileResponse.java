package com.credwallet.backend.modules.identity.presentation.dto;

import java.time.OffsetDateTime;

public record UserProfileResponse(
        Long id,
        String email,
        String username,
        boolean active,
        boolean admin,
        OffsetDateTime createdAt
) {
}
