package com.credwallet.backend.modules.share.presentation;

import java.util.List;

import com.credwallet.backend.global.security.SecurityUtils;
import com.credwallet.backend.modules.share.application.ShareEntry;
import com.credwallet.backend.modules.share.application.ShareService;
import com.credwallet.backend.modules.share.domain.Share;
import com.credwallet.backend.modules.share.presentation.dto.GrantShareRequest;
import com.credwallet.backend.modules.share.presentation.dto.ShareListResponse;
import com.credwallet.backend.modules.share.presentation.dto.ShareResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Shares")
@RestController
@RequestMapping("/credentials/{credentialId}/shares")
public class ShareController {

    private final ShareService shareService;

    public ShareController(ShareService shareService) {
        this.shareService = shareService;
    }

    @Operation(summary = "Shares on a credential", description = "Owner only. Expired shares are listed with effective=false until purged.")
    @GetMapping
    public ResponseEntity<ShareListResponse> listShares(@PathVariable("credentialId") Long credentialId) {
        Long userId = SecurityUtils.getCurrentUserId();
        List<ShareResponse> items = shareService.listForCredential(credentialId, userId).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(new ShareListResponse(items));
    }

    @Operation(
            summary = "Grant or update a share",
            description = """
                    Creates the share or, when the grantee already has one on this credential, \
                    replaces its permission and expiry. Permission is `read` or `write`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Share stored"),
            @ApiResponse(responseCode = "404", description = "Credential or grantee missing, or caller is not the owner"),
            @ApiResponse(responseCode = "422", description = "Self-share or unknown permission")
    })
    @PutMapping
    public ResponseEntity<ShareResponse> grantShare(
            @PathVariable("credentialId") Long credentialId,
            @Valid @RequestBody GrantShareRequest request
    ) {
        Long userId = SecurityUtils.getCurrentUserId();
        ShareEntry entry = shareService.grantEntry(
                credentialId,
                userId,
                request.granteeId(),
                request.permission(),
                request.expiresAt()
        );
        return ResponseEntity.ok(toResponse(entry));
    }

    @Operation(summary = "Revoke a share", description = "Owner only.")
    @DeleteMapping("/{granteeId}")
    public ResponseEntity<Void> revokeShare(
            @PathVariable("credentialId") Long credentialId,
            @PathVariable("granteeId") Long granteeId
    ) {
        Long userId = SecurityUtils.getCurrentUserId();
        shareService.revoke(credentialId, userId, granteeId);
        return ResponseEntity.noContent().build();
    }

    private ShareResponse toResponse(ShareEntry entry) {
        Share share = entry.share();
        return new ShareResponse(
                share.getId(),
                share.getCredentialId(),
                share.getGranteeId(),
                share.getPermission().code(),
                share.getExpiresAt(),
                share.getCreatedAt(),
                entry.effective()
        );
    }
}
