package com.credwallet.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Vault tuning knobs bound from {@code vault.*}.
 */
@ConfigurationProperties(prefix = "vault")
public record VaultProperties(
        @DefaultValue Audit audit,
        @DefaultValue Shares shares
) {

    /**
     * @param recordReads   append {@code credential.read} on every successful credential read
     * @param recordQueries append {@code audit.query} when the audit trail itself is queried
     * @param maxPageSize   upper bound for audit query pages
     */
    public record Audit(
            @DefaultValue("false") boolean recordReads,
            @DefaultValue("false") boolean recordQueries,
            @DefaultValue("200") int maxPageSize
    ) {
    }

    public record Shares(@DefaultValue Purge purge) {
    }

    /**
     * @param retention how long an expired share is kept for history before the purge job removes it
     */
    public record Purge(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("P30D") Duration retention,
            @DefaultValue("PT1H") Duration interval
    ) {
    }
}
