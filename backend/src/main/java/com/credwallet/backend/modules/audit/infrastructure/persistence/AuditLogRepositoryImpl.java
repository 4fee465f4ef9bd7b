package com.credwallet.backend.modules.audit.infrastructure.persistence;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.credwallet.backend.modules.audit.domain.AuditLog;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class AuditLogRepositoryImpl implements AuditLogRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<AuditLog> search(AuditQuery query, AuditCursor after, int limit) {
        Objects.requireNonNull(query, "query must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (query.userId() != null) {
            whereClauses.add("a.actorId = :userId");
            params.put("userId", query.userId());
        }

        if (StringUtils.hasText(query.actionPrefix())) {
            whereClauses.add("a.action like :actionPrefix escape '\\'");
            params.put("actionPrefix", escapeLike(query.actionPrefix()) + "%");
        }

        if (query.since() != null) {
            whereClauses.add("a.createdAt >= :since");
            params.put("since", query.since().withOffsetSameInstant(ZoneOffset.UTC));
        }

        if (query.until() != null) {
            whereClauses.add("a.createdAt < :until");
            params.put("until", query.until().withOffsetSameInstant(ZoneOffset.UTC));
        }

        if (after != null) {
            whereClauses.add("(a.createdAt < :cursorCreatedAt or (a.createdAt = :cursorCreatedAt and a.id < :cursorId))");
            params.put("cursorCreatedAt", after.createdAt().withOffsetSameInstant(ZoneOffset.UTC));
            params.put("cursorId", after.id());
        }

        String whereSql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);
        String jpql = "select a from AuditLog a" + whereSql + " order by a.createdAt desc, a.id desc";

        TypedQuery<AuditLog> typedQuery = entityManager.createQuery(jpql, AuditLog.class);
        params.forEach(typedQuery::setParameter);
        typedQuery.setMaxResults(limit);
        return typedQuery.getResultList();
    }

    private static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
