package com.credwallet.backend.modules.identity.presentation;

import com.credwallet.backend.global.security.SecurityUtils;
import com.credwallet.backend.modules.identity.application.IdentityService;
import com.credwallet.backend.modules.identity.domain.VaultUser;
import com.credwallet.backend.modules.identity.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Users")
@RestController
@RequestMapping("/users")
public class UserController {

    private final IdentityService identityService;

    public UserController(IdentityService identityService) {
        this.identityService = identityService;
    }

    @Operation(summary = "Current user")
    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> getCurrentUser() {
        Long userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(toResponse(identityService.getUser(userId)));
    }

    @Operation(summary = "Deactivate an account", description = "The user themselves or an admin.")
    @PostMapping("/{userId}/deactivate")
    public ResponseEntity<UserProfileResponse> deactivate(@PathVariable("userId") Long userId) {
        Long requesterId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(toResponse(identityService.deactivate(userId, requesterId)));
    }

    @Operation(
            summary = "Delete an account",
            description = "The user themselves or an admin. Owned credentials, their shares, shares granted to the user and eKYC sessions go with it."
    )
    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> delete(@PathVariable("userId") Long userId) {
        Long requesterId = SecurityUtils.getCurrentUserId();
        identityService.delete(userId, requesterId);
        return ResponseEntity.noContent().build();
    }

    private UserProfileResponse toResponse(VaultUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.isActive(),
                user.isAdmin(),
                user.getCreatedAt()
        );
    }
}
