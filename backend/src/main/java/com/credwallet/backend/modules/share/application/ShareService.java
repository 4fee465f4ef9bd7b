package com.credwallet.backend.modules.share.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.credwallet.backend.global.error.VaultException;
import com.credwallet.backend.modules.audit.application.AuditTrailService;
import com.credwallet.backend.modules.audit.domain.AuditActions;
import com.credwallet.backend.modules.credential.domain.Credential;
import com.credwallet.backend.modules.credential.infrastructure.persistence.CredentialRepository;
import com.credwallet.backend.modules.identity.application.IdentityService;
import com.credwallet.backend.modules.share.domain.Share;
import com.credwallet.backend.modules.share.domain.SharePermission;
import com.credwallet.backend.modules.share.infrastructure.persistence.ShareRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Share ledger. Each operation reads the clock once and evaluates every expiry
 * against that single instant.
 */
@Service
@Transactional
public class ShareService {

    private final ShareRepository shareRepository;
    private final CredentialRepository credentialRepository;
    private final IdentityService identityService;
    private final AuditTrailService auditTrailService;
    private final Clock clock;

    public ShareService(
            ShareRepository shareRepository,
            CredentialRepository credentialRepository,
            IdentityService identityService,
            AuditTrailService auditTrailService,
            Clock clock
    ) {
        this.shareRepository = shareRepository;
        this.credentialRepository = credentialRepository;
        this.identityService = identityService;
        this.auditTrailService = auditTrailService;
        this.clock = clock;
    }

    public Share grant(Long credentialId, Long ownerId, Long granteeId, String permission, OffsetDateTime expiresAt) {
        return grantEntry(credentialId, ownerId, granteeId, permission, expiresAt).share();
    }

    /**
     * Same as {@link #grant}, with effectiveness evaluated at the instant the grant was stored.
     */
    public ShareEntry grantEntry(Long credentialId, Long ownerId, Long granteeId, String permission, OffsetDateTime expiresAt) {
        Credential credential = loadCredential(credentialId);
        requireOwner(credential, ownerId);

        if (granteeId == null || granteeId.equals(ownerId)) {
            throw VaultException.invalidArgument("SELF_SHARE", "A credential cannot be shared with its owner");
        }
        SharePermission level = SharePermission.fromCode(permission)
                .orElseThrow(() -> VaultException.invalidArgument("UNKNOWN_PERMISSION",
                        "permission must be one of read, write"));
        identityService.requireActiveUser(granteeId);

        OffsetDateTime now = OffsetDateTime.now(clock);
        Share share = shareRepository.upsert(credential.getId(), granteeId, level, expiresAt, now);
        auditTrailService.append(ownerId, AuditActions.SHARE_GRANT, AuditActions.RESOURCE_SHARE, share.getId());
        return new ShareEntry(share, share.isEffectiveAt(now));
    }

    public void revoke(Long credentialId, Long ownerId, Long granteeId) {
        Credential credential = loadCredential(credentialId);
        requireOwner(credential, ownerId);

        Share share = shareRepository.findByCredentialIdAndGranteeId(credential.getId(), granteeId)
                .orElseThrow(() -> VaultException.notFound("SHARE_NOT_FOUND"));
        shareRepository.delete(share);
        auditTrailService.append(ownerId, AuditActions.SHARE_REVOKE, AuditActions.RESOURCE_SHARE, share.getId());
    }

    /**
     * Pure check against the current instant of the vault clock.
     */
    @Transactional(readOnly = true)
    public boolean isEffective(Share share) {
        return share.isEffectiveAt(OffsetDateTime.now(clock));
    }

    /**
     * Every share on the credential, expired ones included, tagged with effectiveness. Owner only.
     */
    @Transactional(readOnly = true)
    public List<ShareEntry> listForCredential(Long credentialId, Long ownerId) {
        Credential credential = loadCredential(credentialId);
        requireOwner(credential, ownerId);

        OffsetDateTime now = OffsetDateTime.now(clock);
        return shareRepository.findByCredentialIdOrderByIdAsc(credential.getId()).stream()
                .map(share -> new ShareEntry(share, share.isEffectiveAt(now)))
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Share> findEffectiveShare(Long credentialId, Long userId, OffsetDateTime now) {
        if (userId == null) {
            return Optional.empty();
        }
        return shareRepository.findEffective(credentialId, userId, now);
    }

    /**
     * Removes shares that expired at or before {@code cutoff}, one {@code share.purge} entry per row.
     *
     * @return number of shares removed
     */
    public int purgeExpired(OffsetDateTime cutoff) {
        Objects.requireNonNull(cutoff, "cutoff is required");
        List<Share> expired = shareRepository.findExpiredAtOrBefore(cutoff);
        if (expired.isEmpty()) {
            return 0;
        }
        for (Share share : expired) {
            auditTrailService.append(null, AuditActions.SHARE_PURGE, AuditActions.RESOURCE_SHARE, share.getId());
        }
        shareRepository.deleteAllInBatch(expired);
        return expired.size();
    }

    private Credential loadCredential(Long credentialId) {
        Objects.requireNonNull(credentialId, "credentialId is required");
        return credentialRepository.findById(credentialId)
                .orElseThrow(() -> VaultException.notFound("CREDENTIAL_NOT_FOUND"));
    }

    private void requireOwner(Credential credential, Long ownerId) {
        if (!credential.isOwnedBy(ownerId) || !identityService.isActiveUser(ownerId)) {
            throw VaultException.permissionDenied("NOT_CREDENTIAL_OWNER");
        }
    }
}
