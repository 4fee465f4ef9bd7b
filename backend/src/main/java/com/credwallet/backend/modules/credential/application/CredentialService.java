package com.credwallet.backend.modules.credential.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

import com.credwallet.backend.global.config.VaultProperties;
import com.credwallet.backend.global.error.VaultException;
import com.credwallet.backend.modules.audit.application.AuditTrailService;
import com.credwallet.backend.modules.audit.domain.AuditActions;
import com.credwallet.backend.modules.credential.domain.Credential;
import com.credwallet.backend.modules.credential.infrastructure.persistence.CredentialRepository;
import com.credwallet.backend.modules.identity.application.IdentityService;
import com.credwallet.backend.modules.identity.domain.VaultUser;
import com.credwallet.backend.modules.share.application.ShareService;
import com.credwallet.backend.modules.share.domain.SharePermission;
import com.credwallet.backend.modules.share.infrastructure.persistence.ShareRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Credential store. Access is granted to the owner or to the holder of a share
 * that is effective at the instant the operation started.
 */
@Service
@Transactional
public class CredentialService {

    private final CredentialRepository credentialRepository;
    private final ShareRepository shareRepository;
    private final ShareService shareService;
    private final IdentityService identityService;
    private final AuditTrailService auditTrailService;
    private final Clock clock;
    private final boolean recordReads;

    public CredentialService(
            CredentialRepository credentialRepository,
            ShareRepository shareRepository,
            ShareService shareService,
            IdentityService identityService,
            AuditTrailService auditTrailService,
            Clock clock,
            VaultProperties vaultProperties
    ) {
        this.credentialRepository = credentialRepository;
        this.shareRepository = shareRepository;
        this.shareService = shareService;
        this.identityService = identityService;
        this.auditTrailService = auditTrailService;
        this.clock = clock;
        this.recordReads = vaultProperties.audit().recordReads();
    }

    public Credential create(Long ownerId, String title, String description, byte[] ciphertext, byte[] iv) {
        VaultUser owner = identityService.requireActiveUser(ownerId);
        if (!StringUtils.hasText(title)) {
            throw VaultException.invalidArgument("TITLE_REQUIRED", "title must not be empty");
        }
        requireCiphertext(ciphertext);

        Credential credential = new Credential(owner, title.trim(), description, ciphertext, iv);
        Credential saved = credentialRepository.save(credential);
        auditTrailService.append(ownerId, AuditActions.CREDENTIAL_CREATE, AuditActions.RESOURCE_CREDENTIAL, saved.getId());
        return saved;
    }

    public Credential get(Long credentialId, Long requesterId) {
        Credential credential = loadCredential(credentialId);
        requireAccess(credential, requesterId, SharePermission.READ, OffsetDateTime.now(clock));
        if (recordReads) {
            auditTrailService.append(requesterId, AuditActions.CREDENTIAL_READ, AuditActions.RESOURCE_CREDENTIAL, credential.getId());
        }
        return credential;
    }

    public Credential update(Long credentialId, Long requesterId, byte[] newCiphertext, byte[] newIv) {
        Credential credential = loadCredential(credentialId);
        requireAccess(credential, requesterId, SharePermission.WRITE, OffsetDateTime.now(clock));
        requireCiphertext(newCiphertext);

        credential.replaceSecret(newCiphertext, newIv);
        Credential saved = credentialRepository.saveAndFlush(credential);
        auditTrailService.append(requesterId, AuditActions.CREDENTIAL_UPDATE, AuditActions.RESOURCE_CREDENTIAL, saved.getId());
        return saved;
    }

    /**
     * Changes title and description. Owner only; share holders may replace the secret but not relabel it.
     */
    public Credential updateDetails(Long credentialId, Long requesterId, String title, String description) {
        Credential credential = loadCredential(credentialId);
        requireOwner(credential, requesterId);
        if (!StringUtils.hasText(title)) {
            throw VaultException.invalidArgument("TITLE_REQUIRED", "title must not be empty");
        }

        credential.rename(title.trim(), description);
        Credential saved = credentialRepository.saveAndFlush(credential);
        auditTrailService.append(requesterId, AuditActions.CREDENTIAL_UPDATE, AuditActions.RESOURCE_CREDENTIAL, saved.getId());
        return saved;
    }

    public void delete(Long credentialId, Long requesterId) {
        Credential credential = loadCredential(credentialId);
        requireOwner(credential, requesterId);

        Long id = credential.getId();
        shareRepository.deleteByCredentialId(id);
        credentialRepository.deleteById(id);
        auditTrailService.append(requesterId, AuditActions.CREDENTIAL_DELETE, AuditActions.RESOURCE_CREDENTIAL, id);
    }

    /**
     * Owned credentials plus those shared with the user through an effective share, by id.
     */
    @Transactional(readOnly = true)
    public List<Credential> listForUser(Long userId) {
        VaultUser user = identityService.getUser(userId);
        if (!user.isActive()) {
            throw VaultException.permissionDenied("USER_INACTIVE");
        }
        return credentialRepository.findAccessibleByUser(userId, OffsetDateTime.now(clock));
    }

    private Credential loadCredential(Long credentialId) {
        Objects.requireNonNull(credentialId, "credentialId is required");
        return credentialRepository.findById(credentialId)
                .orElseThrow(() -> VaultException.notFound("CREDENTIAL_NOT_FOUND"));
    }

    private void requireOwner(Credential credential, Long requesterId) {
        if (!credential.isOwnedBy(requesterId) || !identityService.isActiveUser(requesterId)) {
            throw VaultException.permissionDenied("NOT_CREDENTIAL_OWNER");
        }
    }

    private void requireAccess(Credential credential, Long requesterId, SharePermission required, OffsetDateTime now) {
        if (!identityService.isActiveUser(requesterId)) {
            throw VaultException.permissionDenied("CREDENTIAL_ACCESS_DENIED");
        }
        if (credential.isOwnedBy(requesterId)) {
            return;
        }
        boolean granted = shareService.findEffectiveShare(credential.getId(), requesterId, now)
                .map(share -> share.getPermission().allows(required))
                .orElse(false);
        if (!granted) {
            throw VaultException.permissionDenied("CREDENTIAL_ACCESS_DENIED");
        }
    }

    private static void requireCiphertext(byte[] ciphertext) {
        if (ciphertext == null || ciphertext.length == 0) {
            throw VaultException.invalidArgument("CIPHERTEXT_REQUIRED", "ciphertext must not be empty");
        }
    }
}
