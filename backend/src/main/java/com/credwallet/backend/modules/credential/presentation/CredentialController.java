package com.credwallet.backend.modules.credential.presentation;

import java.net.URI;
import java.util.List;

import com.credwallet.backend.global.security.SecurityUtils;
import com.credwallet.backend.modules.credential.application.CredentialService;
import com.credwallet.backend.modules.credential.domain.Credential;
import com.credwallet.backend.modules.credential.presentation.dto.CreateCredentialRequest;
import com.credwallet.backend.modules.credential.presentation.dto.CredentialListResponse;
import com.credwallet.backend.modules.credential.presentation.dto.CredentialResponse;
import com.credwallet.backend.modules.credential.presentation.dto.CredentialSummaryResponse;
import com.credwallet.backend.modules.credential.presentation.dto.UpdateCredentialDetailsRequest;
import com.credwallet.backend.modules.credential.presentation.dto.UpdateCredentialSecretRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Credentials")
@RestController
@RequestMapping("/credentials")
public class CredentialController {

    private final CredentialService credentialService;

    public CredentialController(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @Operation(summary = "Accessible credentials", description = "Owned credentials plus those shared through an effective share. Secrets are not included.")
    @GetMapping
    public ResponseEntity<CredentialListResponse> listCredentials() {
        Long userId = SecurityUtils.getCurrentUserId();
        List<CredentialSummaryResponse> items = credentialService.listForUser(userId).stream()
                .map(credential -> toSummaryResponse(credential, userId))
                .toList();
        return ResponseEntity.ok(new CredentialListResponse(items));
    }

    @Operation(summary = "Store a credential")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "422", description = "Blank title or empty ciphertext")
    })
    @PostMapping
    public ResponseEntity<CredentialResponse> createCredential(@Valid @RequestBody CreateCredentialRequest request) {
        Long userId = SecurityUtils.getCurrentUserId();
        Credential created = credentialService.create(
                userId,
                request.title(),
                request.description(),
                request.ciphertext(),
                request.iv()
        );
        return ResponseEntity.created(URI.create("/credentials/" + created.getId()))
                .body(toResponse(created));
    }

    @Operation(summary = "Read a credential", description = "Owner or holder of an effective share. Unauthorized requests get the same 404 as missing ones.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Credential with ciphertext"),
            @ApiResponse(responseCode = "404", description = "Missing or not accessible")
    })
    @GetMapping("/{credentialId}")
    public ResponseEntity<CredentialResponse> getCredential(@PathVariable("credentialId") Long credentialId) {
        Long userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(toResponse(credentialService.get(credentialId, userId)));
    }

    @Operation(summary = "Replace the secret", description = "Owner or holder of an effective write share.")
    @PutMapping("/{credentialId}")
    public ResponseEntity<CredentialResponse> replaceSecret(
            @PathVariable("credentialId") Long credentialId,
            @Valid @RequestBody UpdateCredentialSecretRequest request
    ) {
        Long userId = SecurityUtils.getCurrentUserId();
        Credential updated = credentialService.update(credentialId, userId, request.ciphertext(), request.iv());
        return ResponseEntity.ok(toResponse(updated));
    }

    @Operation(summary = "Rename a credential", description = "Owner only.")
    @PatchMapping("/{credentialId}")
    public ResponseEntity<CredentialResponse> updateDetails(
            @PathVariable("credentialId") Long credentialId,
            @Valid @RequestBody UpdateCredentialDetailsRequest request
    ) {
        Long userId = SecurityUtils.getCurrentUserId();
        Credential updated = credentialService.updateDetails(credentialId, userId, request.title(), request.description());
        return ResponseEntity.ok(toResponse(updated));
    }

    @Operation(summary = "Delete a credential", description = "Owner only. Every share on the credential is removed with it.")
    @DeleteMapping("/{credentialId}")
    public ResponseEntity<Void> deleteCredential(@PathVariable("credentialId") Long credentialId) {
        Long userId = SecurityUtils.getCurrentUserId();
        credentialService.delete(credentialId, userId);
        return ResponseEntity.noContent().build();
    }

    private CredentialResponse toResponse(Credential credential) {
        return new CredentialResponse(
                credential.getId(),
                credential.getOwnerId(),
                credential.getTitle(),
                credential.getDescription(),
                credential.getCiphertext(),
                credential.getIv(),
                credential.getCreatedAt(),
                credential.getUpdatedAt()
        );
    }

    private CredentialSummaryResponse toSummaryResponse(Credential credential, Long userId) {
        return new CredentialSummaryResponse(
                credential.getId(),
                credential.getOwnerId(),
                credential.getTitle(),
                credential.getDescription(),
                credential.isOwnedBy(userId),
                credential.getCreatedAt(),
                credential.getUpdatedAt()
        );
    }
}
