package com.credwallet.backend.modules.credential.presentation.dto;

import java.time.OffsetDateTime;

public record CredentialResponse(
        Long id,
        Long ownerId,
        String title,
        String description,
        byte[] ciphertext,
        byte[] iv,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
