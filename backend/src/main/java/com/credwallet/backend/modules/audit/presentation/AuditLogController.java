package com.credwallet.backend.modules.audit.presentation;

import java.time.OffsetDateTime;
import java.util.List;

import com.credwallet.backend.global.security.SecurityUtils;
import com.credwallet.backend.modules.audit.application.AuditPage;
import com.credwallet.backend.modules.audit.application.AuditTrailService;
import com.credwallet.backend.modules.audit.domain.AuditLog;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditQuery;
import com.credwallet.backend.modules.audit.presentation.dto.AuditLogPageResponse;
import com.credwallet.backend.modules.audit.presentation.dto.AuditLogResponse;
import com.credwallet.backend.modules.identity.application.IdentityService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Audit")
@RestController
@RequestMapping("/audit-logs")
public class AuditLogController {

    private final AuditTrailService auditTrailService;
    private final IdentityService identityService;

    public AuditLogController(AuditTrailService auditTrailService, IdentityService identityService) {
        this.auditTrailService = auditTrailService;
        this.identityService = identityService;
    }

    @Operation(
            summary = "Audit trail",
            description = """
                    Newest first. Admins may filter by any `userId`; everyone else only sees \
                    entries they authored. Pass `nextPageToken` back as `pageToken` for the next page.
                    """
    )
    @GetMapping
    public ResponseEntity<AuditLogPageResponse> getAuditLogs(
            @Parameter(description = "Actor filter, admins only")
            @RequestParam(name = "userId", required = false) Long userId,
            @Parameter(description = "Action prefix, e.g. `credential.`")
            @RequestParam(name = "action", required = false) String actionPrefix,
            @RequestParam(name = "since", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime since,
            @RequestParam(name = "until", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime until,
            @RequestParam(name = "pageToken", required = false) String pageToken,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        Long requesterId = SecurityUtils.getCurrentUserId();
        AuditQuery query = new AuditQuery(userId, actionPrefix, since, until);
        if (!identityService.isAdmin(requesterId)) {
            query = query.withUserId(requesterId);
        }

        AuditPage page = auditTrailService.queryAs(requesterId, query, pageToken, size);
        List<AuditLogResponse> items = page.entries().stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(new AuditLogPageResponse(items, page.nextPageToken()));
    }

    private AuditLogResponse toResponse(AuditLog entry) {
        return new AuditLogResponse(
                entry.getId(),
                entry.getActorId(),
                entry.getAction(),
                entry.getResourceType(),
                entry.getResourceId(),
                entry.getIpAddress(),
                entry.getUserAgent(),
                entry.getCreatedAt()
        );
    }
}
