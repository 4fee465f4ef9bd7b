package com.credwallet.backend.modules.share.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Objects;

import com.credwallet.backend.modules.share.domain.Share;
import com.credwallet.backend.modules.share.domain.SharePermission;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import org.hibernate.query.NativeQuery;
import org.springframework.stereotype.Repository;

@Repository
public class ShareRepositoryImpl implements ShareRepositoryCustom {

    private static final String UPSERT_SQL = """
            INSERT INTO shares (credential_id, shared_with_user_id, permission, expires_at, created_at)
            VALUES (:credentialId, :granteeId, :permission, CAST(:expiresAt AS TIMESTAMPTZ), :createdAt)
            ON CONFLICT (credential_id, shared_with_user_id)
            DO UPDATE SET permission = EXCLUDED.permission,
                          expires_at = EXCLUDED.expires_at
            RETURNING id
            """;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Share upsert(Long credentialId, Long granteeId, SharePermission permission, OffsetDateTime expiresAt, OffsetDateTime createdAt) {
        Objects.requireNonNull(credentialId, "credentialId must not be null");
        Objects.requireNonNull(granteeId, "granteeId must not be null");
        Objects.requireNonNull(permission, "permission must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");

        NativeQuery<?> query = entityManager.createNativeQuery(UPSERT_SQL).unwrap(NativeQuery.class);
        query.setParameter("credentialId", credentialId);
        query.setParameter("granteeId", granteeId);
        query.setParameter("permission", permission.code());
        // typed so a null expiry still binds as timestamptz
        query.setParameter("expiresAt", expiresAt, OffsetDateTime.class);
        query.setParameter("createdAt", createdAt, OffsetDateTime.class);
        Number id = (Number) query.getSingleResult();

        Share share = entityManager.find(Share.class, id.longValue());
        // an instance already in the persistence context still holds the pre-upsert values
        entityManager.refresh(share);
        return share;
    }
}
