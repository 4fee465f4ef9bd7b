package com.credwallet.backend.modules.identity.application;

import java.util.Objects;

import com.credwallet.backend.global.error.VaultException;
import com.credwallet.backend.modules.audit.application.AuditTrailService;
import com.credwallet.backend.modules.audit.domain.AuditActions;
import com.credwallet.backend.modules.identity.domain.VaultUser;
import com.credwallet.backend.modules.identity.infrastructure.persistence.VaultUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Thin account store. Registration and login flows live in the identity service;
 * the vault only needs existence, active and admin checks plus the lifecycle
 * operations whose side effects (cascades, audit) it owns.
 */
@Service
@Transactional
public class IdentityService {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final VaultUserRepository vaultUserRepository;
    private final AuditTrailService auditTrailService;

    public IdentityService(VaultUserRepository vaultUserRepository, AuditTrailService auditTrailService) {
        this.vaultUserRepository = vaultUserRepository;
        this.auditTrailService = auditTrailService;
    }

    public VaultUser register(String email, String username, String passwordHash, boolean admin) {
        if (!StringUtils.hasText(email)) {
            throw VaultException.invalidArgument("EMAIL_REQUIRED", "email must not be blank");
        }
        VaultUser user = new VaultUser();
        user.setEmail(email.trim());
        user.setUsername(StringUtils.hasText(username) ? username.trim() : null);
        user.setPasswordHash(passwordHash);
        user.setAdmin(admin);
        user.setActive(true);

        VaultUser saved;
        try {
            // flush so the unique constraints decide, not a racy pre-check
            saved = vaultUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw VaultException.conflict("USER_ALREADY_EXISTS", ex);
        }
        auditTrailService.append(saved.getId(), AuditActions.USER_REGISTER, AuditActions.RESOURCE_USER, saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public VaultUser getUser(Long userId) {
        Objects.requireNonNull(userId, "userId is required");
        return vaultUserRepository.findById(userId)
                .orElseThrow(() -> VaultException.notFound("USER_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public VaultUser requireActiveUser(Long userId) {
        Objects.requireNonNull(userId, "userId is required");
        return vaultUserRepository.findActiveById(userId)
                .orElseThrow(() -> VaultException.notFound("USER_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public boolean isActiveUser(Long userId) {
        return userId != null && vaultUserRepository.findActiveById(userId).isPresent();
    }

    @Transactional(readOnly = true)
    public boolean isAdmin(Long userId) {
        return userId != null && vaultUserRepository.findActiveById(userId)
                .map(VaultUser::isAdmin)
                .orElse(false);
    }

    public VaultUser deactivate(Long userId, Long requesterId) {
        VaultUser target = getUser(userId);
        requireSelfOrAdmin(target, requesterId);
        if (target.isActive()) {
            target.setActive(false);
        }
        auditTrailService.append(requesterId, AuditActions.USER_DEACTIVATE, AuditActions.RESOURCE_USER, target.getId());
        return target;
    }

    /**
     * Removes the account. The store cascades to owned credentials, every share on them,
     * shares granted to this user and eKYC sessions, and nulls the actor of authored audit entries.
     */
    public void delete(Long userId, Long requesterId) {
        VaultUser target = getUser(userId);
        requireSelfOrAdmin(target, requesterId);

        // written before the delete so a self-deletion entry gets its actor nulled like the rest
        auditTrailService.append(requesterId, AuditActions.USER_DELETE, AuditActions.RESOURCE_USER, target.getId());
        int removed = vaultUserRepository.deleteByIdCascading(target.getId());
        if (removed == 0) {
            throw VaultException.notFound("USER_NOT_FOUND");
        }
        log.info("Deleted user {} on behalf of {}", target.getId(), requesterId);
    }

    private void requireSelfOrAdmin(VaultUser target, Long requesterId) {
        if (Objects.equals(target.getId(), requesterId)) {
            return;
        }
        if (!isAdmin(requesterId)) {
            throw VaultException.permissionDenied("USER_FORBIDDEN");
        }
    }
}
