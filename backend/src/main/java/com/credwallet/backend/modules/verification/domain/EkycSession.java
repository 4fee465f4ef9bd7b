package com.credwallet.backend.modules.verification.domain;

import java.util.LinkedHashMap;
import java.util.Map;

import com.credwallet.backend.global.jpa.AbstractTimestampedEntity;
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

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One identity verification attempt. The provider payload is kept verbatim.
 */
@Entity
@Table(name = "ekyc_sessions")
public class EkycSession extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private VaultUser user;

    @Column(name = "user_id", insertable = false, updatable = false)
    private Long userId;

    @Column(name = "status", nullable = false, length = 16)
    private String status = EkycStatus.PENDING.code();

    @Column(name = "provider")
    private String provider;

    @Column(name = "reference_id")
    private String referenceId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_json", columnDefinition = "jsonb")
    private Map<String, Object> resultJson;

    protected EkycSession() {
    }

    public EkycSession(VaultUser user, String provider) {
        this.user = user;
        this.userId = user.getId();
        this.provider = provider;
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public EkycStatus getStatus() {
        return EkycStatus.fromCode(status)
                .orElseThrow(() -> new IllegalStateException("Unknown eKYC status: " + status));
    }

    public String getProvider() {
        return provider;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public Map<String, Object> getResultJson() {
        return resultJson;
    }

    public void recordResult(EkycStatus status, String referenceId, Map<String, Object> payload) {
        this.status = status.code();
        if (referenceId != null) {
            this.referenceId = referenceId;
        }
        if (payload != null) {
            this.resultJson = new LinkedHashMap<>(payload);
        }
    }
}
