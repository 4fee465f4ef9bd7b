package com.credwallet.backend.modules.share.presentation.dto;

import java.time.OffsetDateTime;

public record ShareResponse(
        Long id,
        Long credentialId,
        Long granteeId,
        String permission,
        OffsetDateTime expiresAt,
        OffsetDateTime createdAt,
        boolean effective
) {
}
