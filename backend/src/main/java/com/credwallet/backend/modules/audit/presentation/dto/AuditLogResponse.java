package com.credwallet.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;

public record AuditLogResponse(
        Long id,
        Long userId,
        String action,
        String resourceType,
        Long resourceId,
        String ipAddress,
        String userAgent,
        OffsetDateTime createdAt
) {
}
