package com.credwallet.backend.modules.audit.application;

import java.util.List;

import com.credwallet.backend.modules.audit.domain.AuditLog;

/**
 * One page of audit entries. {@code nextPageToken} is null on the last page.
 */
public record AuditPage(List<AuditLog> entries, String nextPageToken) {

    public AuditPage {
        entries = List.copyOf(entries);
    }

    public boolean hasNext() {
        return nextPageToken != null;
    }
}
