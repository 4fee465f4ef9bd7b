package com.credwallet.backend.modules.audit.infrastructure.persistence;

import java.util.List;

import com.credwallet.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepositoryCustom {

    /**
     * Entries matching {@code query}, newest first, strictly after {@code after} when given.
     */
    List<AuditLog> search(AuditQuery query, AuditCursor after, int limit);
}
