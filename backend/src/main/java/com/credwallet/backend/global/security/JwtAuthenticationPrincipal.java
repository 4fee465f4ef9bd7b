package com.credwallet.backend.global.security;

import java.util.List;

public record JwtAuthenticationPrincipal(Long userId, List<String> roles) {
}
