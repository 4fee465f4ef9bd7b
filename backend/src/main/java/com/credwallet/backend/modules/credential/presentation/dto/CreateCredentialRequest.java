package com.credwallet.backend.modules.credential.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * {@code ciphertext} and {@code iv} are base64 in JSON.
 */
public record CreateCredentialRequest(
        @NotBlank(message = "title is required")
        @Size(max = 200)
        String title,
        String description,
        @NotNull(message = "ciphertext is required")
        byte[] ciphertext,
        byte[] iv
) {
}
