package com.credwallet.backend.global.web;

/**
 * Network origin of the current call, copied into audit entries.
 * Both parts are optional; system jobs run without one.
 */
public record ClientOrigin(String ipAddress, String userAgent) {

    private static final ClientOrigin UNKNOWN = new ClientOrigin(null, null);

    private static final ThreadLocal<ClientOrigin> CURRENT = new ThreadLocal<>();

    public static ClientOrigin current() {
        ClientOrigin origin = CURRENT.get();
        return origin != null ? origin : UNKNOWN;
    }

    static void bind(ClientOrigin origin) {
        CURRENT.set(origin);
    }

    static void clear() {
        CURRENT.remove();
    }
}
