package com.credwallet.backend.support;

import com.credwallet.backend.modules.identity.application.IdentityService;
import com.credwallet.backend.modules.identity.domain.VaultUser;

import org.springframework.stereotype.Component;

@Component
public class TestUserFactory {

    private final IdentityService identityService;

    public TestUserFactory(IdentityService identityService) {
        this.identityService = identityService;
    }

    public VaultUser createUser(String username) {
        return identityService.register(username + "@example.com", username, "opaque-hash", false);
    }

    public VaultUser createAdmin(String username) {
        return identityService.register(username + "@example.com", username, "opaque-hash", true);
    }
}
