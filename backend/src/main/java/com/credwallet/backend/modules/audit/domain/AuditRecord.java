package com.credwallet.backend.modules.audit.domain;

import java.util.Objects;

/**
 * Input for one audit entry. {@code actorId} is null for system actions.
 */
public record AuditRecord(
        Long actorId,
        String action,
        String resourceType,
        Long resourceId,
        String ipAddress,
        String userAgent
) {

    public AuditRecord {
        Objects.requireNonNull(action, "action is required");
    }

    public static AuditRecord of(Long actorId, String action, String resourceType, Long resourceId) {
        return new AuditRecord(actorId, action, resourceType, resourceId, null, null);
    }

    public AuditRecord withOrigin(String ipAddress, String userAgent) {
        return new AuditRecord(actorId, action, resourceType, resourceId, ipAddress, userAgent);
    }
}
