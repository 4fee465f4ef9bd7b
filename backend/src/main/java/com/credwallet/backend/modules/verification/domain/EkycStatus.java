package com.credwallet.backend.modules.verification.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum EkycStatus {
    PENDING("pending"),
    IN_REVIEW("in_review"),
    APPROVED("approved"),
    REJECTED("rejected"),
    EXPIRED("expired");

    private final String code;

    EkycStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == EXPIRED;
    }

    public static Optional<EkycStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.code.equals(normalized))
                .findFirst();
    }
}
