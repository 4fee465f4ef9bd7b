package com.credwallet.backend.modules.audit.infrastructure.persistence;

import java.util.List;

import com.credwallet.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long>, AuditLogRepositoryCustom {

    List<AuditLog> findByActionOrderByIdAsc(String action);

    List<AuditLog> findByResourceTypeAndResourceIdOrderByIdAsc(String resourceType, Long resourceId);
}
