package com.credwallet.backend.modules.verification.presentation;

import java.net.URI;

import com.credwallet.backend.global.security.SecurityUtils;
import com.credwallet.backend.modules.verification.application.EkycService;
import com.credwallet.backend.modules.verification.domain.EkycSession;
import com.credwallet.backend.modules.verification.presentation.dto.EkycSessionResponse;
import com.credwallet.backend.modules.verification.presentation.dto.RecordEkycResultRequest;
import com.credwallet.backend.modules.verification.presentation.dto.StartEkycSessionRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "eKYC")
@RestController
@RequestMapping("/ekyc/sessions")
public class EkycController {

    private final EkycService ekycService;

    public EkycController(EkycService ekycService) {
        this.ekycService = ekycService;
    }

    @Operation(summary = "Start a verification session", description = "The session starts in status `pending`.")
    @PostMapping
    public ResponseEntity<EkycSessionResponse> startSession(@Valid @RequestBody(required = false) StartEkycSessionRequest request) {
        Long userId = SecurityUtils.getCurrentUserId();
        String provider = request != null ? request.provider() : null;
        EkycSession session = ekycService.start(userId, provider);
        return ResponseEntity.created(URI.create("/ekyc/sessions/" + session.getId()))
                .body(toResponse(session));
    }

    @Operation(summary = "Latest verification session of the caller")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Most recent session"),
            @ApiResponse(responseCode = "404", description = "No session yet")
    })
    @GetMapping("/latest")
    public ResponseEntity<EkycSessionResponse> getLatestSession() {
        Long userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(toResponse(ekycService.getLatest(userId)));
    }

    @Operation(
            summary = "Record a provider result",
            description = """
                    Provider callback, requires role `EKYC_PROVIDER`. Status is one of \
                    `pending`, `in_review`, `approved`, `rejected`, `expired`; any change is accepted.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Result recorded"),
            @ApiResponse(responseCode = "404", description = "Unknown session"),
            @ApiResponse(responseCode = "422", description = "Unknown status")
    })
    @PostMapping("/{sessionId}/result")
    public ResponseEntity<EkycSessionResponse> recordResult(
            @PathVariable("sessionId") Long sessionId,
            @Valid @RequestBody RecordEkycResultRequest request
    ) {
        EkycSession session = ekycService.recordResult(sessionId, request.status(), request.referenceId(), request.result());
        return ResponseEntity.ok(toResponse(session));
    }

    private EkycSessionResponse toResponse(EkycSession session) {
        return new EkycSessionResponse(
                session.getId(),
                session.getUserId(),
                session.getStatus().code(),
                session.getProvider(),
                session.getReferenceId(),
                session.getResultJson(),
                session.getCreatedAt(),
                session.getUpdatedAt()
        );
    }
}
