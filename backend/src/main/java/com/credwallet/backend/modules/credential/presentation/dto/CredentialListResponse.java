package com.credwallet.backend.modules.credential.presentation.dto;

import java.util.List;

public record CredentialListResponse(List<CredentialSummaryResponse> items) {
}
