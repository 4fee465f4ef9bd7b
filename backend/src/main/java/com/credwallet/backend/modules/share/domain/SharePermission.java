package com.credwallet.backend.modules.share.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Access level of a share, stored by its lowercase code.
 */
public enum SharePermission {

    READ("read"),
    WRITE("write");

    private final String code;

    SharePermission(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Write implies read.
     */
    public boolean allows(SharePermission required) {
        return this == WRITE || required == READ;
    }

    public static Optional<SharePermission> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(permission -> permission.code.equals(normalized))
                .findFirst();
    }
}
