package com.credwallet.backend.modules.audit.presentation.dto;

import java.util.List;

public record AuditLogPageResponse(List<AuditLogResponse> items, String nextPageToken) {
}
