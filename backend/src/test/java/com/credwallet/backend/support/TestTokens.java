package com.credwallet.backend.support;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;

import com.credwallet.backend.modules.identity.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Component;

/**
 * Mints access tokens the way the identity service would, signed with the test secret.
 */
@Component
public class TestTokens {

    private final JwtTokenProvider tokenProvider;

    public TestTokens(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }

    public String bearer(Long userId, String... roles) {
        return "Bearer " + accessToken(userId, List.of(roles), Instant.now().plus(15, ChronoUnit.MINUTES));
    }

    public String accessToken(Long userId, List<String> roles, Instant expiresAt) {
        Instant issuedAt = expiresAt.minus(15, ChronoUnit.MINUTES);
        return Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim("roles", roles)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }
}
