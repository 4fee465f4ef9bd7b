package com.credwallet.backend.global.error;

public class VaultException extends ProblemException {

    private final VaultErrorKind kind;

    public VaultException(VaultErrorKind kind, String code) {
        this(kind, code, null, null);
    }

    public VaultException(VaultErrorKind kind, String code, String detail) {
        this(kind, code, detail, null);
    }

    public VaultException(VaultErrorKind kind, String code, String detail, Throwable cause) {
        super(kind.status(), code, detail, cause);
        this.kind = kind;
    }

    public VaultErrorKind getKind() {
        return kind;
    }

    public static VaultException notFound(String code) {
        return new VaultException(VaultErrorKind.NOT_FOUND, code);
    }

    public static VaultException permissionDenied(String code) {
        return new VaultException(VaultErrorKind.PERMISSION_DENIED, code);
    }

    public static VaultException invalidArgument(String code, String detail) {
        return new VaultException(VaultErrorKind.INVALID_ARGUMENT, code, detail);
    }

    public static VaultException conflict(String code, Throwable cause) {
        return new VaultException(VaultErrorKind.CONFLICT, code, null, cause);
    }
}
