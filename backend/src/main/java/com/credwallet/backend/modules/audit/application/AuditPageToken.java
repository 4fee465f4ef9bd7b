package com.credwallet.backend.modules.audit.application;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Base64;

import com.credwallet.backend.global.error.VaultException;
import com.credwallet.backend.modules.audit.domain.AuditLog;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditCursor;

/**
 * Opaque keyset page token: {@code epochSecond.nano:id} of the last entry served, base64url encoded.
 */
final class AuditPageToken {

    private AuditPageToken() {
    }

    static String encode(AuditLog last) {
        Instant instant = last.getCreatedAt().toInstant();
        String raw = instant.getEpochSecond() + "." + instant.getNano() + ":" + last.getId();
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    static AuditCursor decode(String token) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
            int colon = raw.indexOf(':');
            int dot = raw.indexOf('.');
            if (colon < 0 || dot < 0 || dot > colon) {
                throw invalid();
            }
            long seconds = Long.parseLong(raw.substring(0, dot));
            long nanos = Long.parseLong(raw.substring(dot + 1, colon));
            long id = Long.parseLong(raw.substring(colon + 1));
            OffsetDateTime createdAt = OffsetDateTime.ofInstant(Instant.ofEpochSecond(seconds, nanos), ZoneOffset.UTC);
            return new AuditCursor(createdAt, id);
        } catch (IllegalArgumentException | DateTimeException ex) {
            throw invalid();
        }
    }

    private static VaultException invalid() {
        return VaultException.invalidArgument("INVALID_PAGE_TOKEN", "Malformed audit page token");
    }
}
