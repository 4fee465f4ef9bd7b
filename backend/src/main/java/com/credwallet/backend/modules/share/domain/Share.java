package com.credwallet.backend.modules.share.domain;

import java.time.OffsetDateTime;

import com.credwallet.backend.modules.credential.domain.Credential;
import com.credwallet.backend.modules.identity.domain.VaultUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Grant of access on a credential to another user. Rows are written through the
 * ledger's upsert; expired rows stay until explicitly purged.
 */
@Entity
@Table(name = "shares")
public class Share {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "credential_id", nullable = false, insertable = false, updatable = false)
    private Credential credential;

    @Column(name = "credential_id", nullable = false, updatable = false)
    private Long credentialId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "shared_with_user_id", nullable = false, insertable = false, updatable = false)
    private VaultUser grantee;

    @Column(name = "shared_with_user_id", nullable = false, updatable = false)
    private Long granteeId;

    @Column(name = "permission", nullable = false, length = 16)
    private String permission;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected Share() {
    }

    public Share(Long credentialId, Long granteeId, SharePermission permission, OffsetDateTime expiresAt, OffsetDateTime createdAt) {
        this.credentialId = credentialId;
        this.granteeId = granteeId;
        this.permission = permission.code();
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public Long getCredentialId() {
        return credentialId;
    }

    public Long getGranteeId() {
        return granteeId;
    }

    public SharePermission getPermission() {
        return SharePermission.fromCode(permission)
                .orElseThrow(() -> new IllegalStateException("Unknown share permission: " + permission));
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    /**
     * A share is effective while it has no expiry or the expiry is strictly after {@code now}.
     */
    public boolean isEffectiveAt(OffsetDateTime now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
