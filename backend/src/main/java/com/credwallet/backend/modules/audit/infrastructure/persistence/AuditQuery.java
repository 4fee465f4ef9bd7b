package com.credwallet.backend.modules.audit.infrastructure.persistence;

import java.time.OffsetDateTime;

/**
 * Audit trail filters. Every field is optional; {@code since} is inclusive and {@code until} exclusive.
 */
public record AuditQuery(
        Long userId,
        String actionPrefix,
        OffsetDateTime since,
        OffsetDateTime until
) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null);
    }

    public static AuditQuery forUser(Long userId) {
        return new AuditQuery(userId, null, null, null);
    }

    public AuditQuery withUserId(Long forcedUserId) {
        return new AuditQuery(forcedUserId, actionPrefix, since, until);
    }
}
