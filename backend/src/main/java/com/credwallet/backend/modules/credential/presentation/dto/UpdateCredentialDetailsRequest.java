package com.credwallet.backend.modules.credential.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateCredentialDetailsRequest(
        @NotBlank(message = "title is required")
        @Size(max = 200)
        String title,
        String description
) {
}
