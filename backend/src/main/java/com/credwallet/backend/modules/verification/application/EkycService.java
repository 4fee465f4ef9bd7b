package com.credwallet.backend.modules.verification.application;

import java.util.Map;
import java.util.Objects;

import com.credwallet.backend.global.error.VaultException;
import com.credwallet.backend.modules.audit.application.AuditTrailService;
import com.credwallet.backend.modules.audit.domain.AuditActions;
import com.credwallet.backend.modules.identity.application.IdentityService;
import com.credwallet.backend.modules.identity.domain.VaultUser;
import com.credwallet.backend.modules.verification.domain.EkycSession;
import com.credwallet.backend.modules.verification.domain.EkycStatus;
import com.credwallet.backend.modules.verification.infrastructure.persistence.EkycSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tracks verification sessions. Status changes are recorded as reported by the
 * provider; no transition order is imposed.
 */
@Service
@Transactional
public class EkycService {

    private static final Logger log = LoggerFactory.getLogger(EkycService.class);

    private final EkycSessionRepository ekycSessionRepository;
    private final IdentityService identityService;
    private final AuditTrailService auditTrailService;

    public EkycService(
            EkycSessionRepository ekycSessionRepository,
            IdentityService identityService,
            AuditTrailService auditTrailService
    ) {
        this.ekycSessionRepository = ekycSessionRepository;
        this.identityService = identityService;
        this.auditTrailService = auditTrailService;
    }

    public EkycSession start(Long userId, String provider) {
        VaultUser user = identityService.getUser(userId);
        EkycSession session = ekycSessionRepository.saveAndFlush(new EkycSession(user, provider));
        auditTrailService.append(userId, AuditActions.EKYC_START, AuditActions.RESOURCE_EKYC_SESSION, session.getId());
        return session;
    }

    public EkycSession recordResult(Long sessionId, String status, String referenceId, Map<String, Object> resultPayload) {
        Objects.requireNonNull(sessionId, "sessionId is required");
        EkycSession session = ekycSessionRepository.findById(sessionId)
                .orElseThrow(() -> VaultException.notFound("EKYC_SESSION_NOT_FOUND"));
        EkycStatus next = EkycStatus.fromCode(status)
                .orElseThrow(() -> VaultException.invalidArgument("UNKNOWN_EKYC_STATUS",
                        "status must be one of pending, in_review, approved, rejected, expired"));

        EkycStatus previous = session.getStatus();
        if (previous.isTerminal() && previous != next) {
            log.warn("eKYC session {} moved from terminal status {} to {}", session.getId(), previous.code(), next.code());
        }
        session.recordResult(next, referenceId, resultPayload);
        EkycSession saved = ekycSessionRepository.saveAndFlush(session);
        auditTrailService.append(null, AuditActions.EKYC_RESULT, AuditActions.RESOURCE_EKYC_SESSION, saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public EkycSession getLatest(Long userId) {
        Objects.requireNonNull(userId, "userId is required");
        return ekycSessionRepository.findFirstByUserIdOrderByCreatedAtDescIdDesc(userId)
                .orElseThrow(() -> VaultException.notFound("EKYC_SESSION_NOT_FOUND"));
    }
}
