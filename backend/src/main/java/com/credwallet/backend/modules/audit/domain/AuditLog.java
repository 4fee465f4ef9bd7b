package com.credwallet.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

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

import org.hibernate.annotations.Immutable;

/**
 * Append-only record of a security relevant action.
 * The actor reference is nulled by the store when the user is deleted;
 * {@code resourceId} is deliberately not a foreign key.
 */
@Entity
@Immutable
@Table(name = "audit_logs")
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private VaultUser actor;

    @Column(name = "user_id", insertable = false, updatable = false)
    private Long actorId;

    @Column(name = "action", nullable = false)
    private String action;

    @Column(name = "resource_type")
    private String resourceType;

    @Column(name = "resource_id")
    private Long resourceId;

    @Column(name = "ip_address")
    private String ipAddress;

    @Column(name = "user_agent")
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    public static AuditLog of(AuditRecord record, VaultUser actorReference, OffsetDateTime createdAt) {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        AuditLog log = new AuditLog();
        log.actor = actorReference;
        log.actorId = record.actorId();
        log.action = record.action();
        log.resourceType = record.resourceType();
        log.resourceId = record.resourceId();
        log.ipAddress = record.ipAddress();
        log.userAgent = record.userAgent();
        // same precision as the timestamptz column
        log.createdAt = createdAt.truncatedTo(ChronoUnit.MICROS);
        return log;
    }

    public Long getId() {
        return id;
    }

    /**
     * Null when the action had no authenticated actor or the actor was deleted since.
     */
    public Long getActorId() {
        return actorId;
    }

    public String getAction() {
        return action;
    }

    public String getResourceType() {
        return resourceType;
    }

    public Long getResourceId() {
        return resourceId;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
