package com.credwallet.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the vault core. The core always reports the precise kind;
 * hiding the difference between {@link #NOT_FOUND} and {@link #PERMISSION_DENIED}
 * from unauthorized callers is done at the HTTP boundary.
 */
public enum VaultErrorKind {

    NOT_FOUND(HttpStatus.NOT_FOUND),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    INVALID_ARGUMENT(HttpStatus.UNPROCESSABLE_ENTITY),
    CONFLICT(HttpStatus.CONFLICT),
    STORAGE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    VaultErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
