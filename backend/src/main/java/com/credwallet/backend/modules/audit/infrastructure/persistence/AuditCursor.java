package com.credwallet.backend.modules.audit.infrastructure.persistence;

import java.time.OffsetDateTime;

/**
 * Position of the last entry of a page in {@code created_at DESC, id DESC} order.
 */
public record AuditCursor(OffsetDateTime createdAt, Long id) {
}
