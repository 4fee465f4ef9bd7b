package com.credwallet.backend.modules.credential.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateCredentialSecretRequest(
        @NotNull(message = "ciphertext is required")
        byte[] ciphertext,
        byte[] iv
) {
}
