package com.credwallet.backend.modules.verification.presentation.dto;

import jakarta.validation.constraints.Size;

public record StartEkycSessionRequest(
        @Size(max = 100)
        String provider
) {
}
