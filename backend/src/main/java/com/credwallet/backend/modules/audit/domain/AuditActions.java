package com.credwallet.backend.modules.audit.domain;

/**
 * Action and resource type codes written by the vault itself. Callers may append
 * other actions (authentication events, for example); the column is free text.
 */
public final class AuditActions {

    public static final String USER_REGISTER = "user.register";
    public static final String USER_DEACTIVATE = "user.deactivate";
    public static final String USER_DELETE = "user.delete";

    public static final String CREDENTIAL_CREATE = "credential.create";
    public static final String CREDENTIAL_READ = "credential.read";
    public static final String CREDENTIAL_UPDATE = "credential.update";
    public static final String CREDENTIAL_DELETE = "credential.delete";

    public static final String SHARE_GRANT = "share.grant";
    public static final String SHARE_REVOKE = "share.revoke";
    public static final String SHARE_PURGE = "share.purge";

    public static final String EKYC_START = "ekyc.start";
    public static final String EKYC_RESULT = "ekyc.result";

    public static final String AUDIT_QUERY = "audit.query";

    public static final String RESOURCE_USER = "user";
    public static final String RESOURCE_CREDENTIAL = "credential";
    public static final String RESOURCE_SHARE = "share";
    public static final String RESOURCE_EKYC_SESSION = "ekyc_session";
    public static final String RESOURCE_AUDIT_LOG = "audit_log";

    private AuditActions() {
    }
}
