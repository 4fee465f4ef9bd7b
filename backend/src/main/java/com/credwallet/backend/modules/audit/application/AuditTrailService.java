package com.credwallet.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.credwallet.backend.global.config.VaultProperties;
import com.credwallet.backend.global.web.ClientOrigin;
import com.credwallet.backend.modules.audit.domain.AuditActions;
import com.credwallet.backend.modules.audit.domain.AuditLog;
import com.credwallet.backend.modules.audit.domain.AuditRecord;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditCursor;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditQuery;
import com.credwallet.backend.modules.identity.domain.VaultUser;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only audit trail. {@link #append} joins the caller's transaction, so a
 * failed append rolls back the mutation it describes.
 */
@Service
@Transactional
public class AuditTrailService {

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;
    private final VaultProperties.Audit auditProperties;

    public AuditTrailService(
            AuditLogRepository auditLogRepository,
            EntityManager entityManager,
            Clock clock,
            VaultProperties vaultProperties
    ) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
        this.auditProperties = vaultProperties.audit();
    }

    /**
     * Writes one entry. Missing ip / user agent are taken from the current request, if any.
     */
    public AuditLog append(AuditRecord record) {
        AuditRecord effective = record;
        if (record.ipAddress() == null && record.userAgent() == null) {
            ClientOrigin origin = ClientOrigin.current();
            effective = record.withOrigin(origin.ipAddress(), origin.userAgent());
        }

        VaultUser actorReference = null;
        if (effective.actorId() != null) {
            actorReference = entityManager.getReference(VaultUser.class, effective.actorId());
        }

        AuditLog entry = AuditLog.of(effective, actorReference, OffsetDateTime.now(clock));
        return auditLogRepository.save(entry);
    }

    public AuditLog append(Long actorId, String action, String resourceType, Long resourceId) {
        return append(AuditRecord.of(actorId, action, resourceType, resourceId));
    }

    @Transactional(readOnly = true)
    public AuditPage query(AuditQuery query, String pageToken, int pageSize) {
        int limit = clampPageSize(pageSize);
        AuditCursor after = pageToken == null || pageToken.isBlank() ? null : AuditPageToken.decode(pageToken);

        // one extra row tells whether another page exists
        List<AuditLog> rows = auditLogRepository.search(query, after, limit + 1);
        if (rows.size() <= limit) {
            return new AuditPage(rows, null);
        }
        List<AuditLog> page = rows.subList(0, limit);
        return new AuditPage(page, AuditPageToken.encode(page.get(page.size() - 1)));
    }

    /**
     * Same as {@link #query}, recording the lookup itself when {@code vault.audit.record-queries} is on.
     */
    public AuditPage queryAs(Long requesterId, AuditQuery query, String pageToken, int pageSize) {
        if (auditProperties.recordQueries()) {
            append(requesterId, AuditActions.AUDIT_QUERY, AuditActions.RESOURCE_AUDIT_LOG, null);
        }
        return query(query, pageToken, pageSize);
    }

    /**
     * Lazily walks every matching entry, newest first, fetching one page at a time.
     */
    @Transactional(propagation = Propagation.SUPPORTS, readOnly = true)
    public Stream<AuditLog> stream(AuditQuery query, int pageSize) {
        Iterator<AuditLog> iterator = new PagingIterator(query, clampPageSize(pageSize));
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private int clampPageSize(int pageSize) {
        return Math.min(Math.max(pageSize, 1), auditProperties.maxPageSize());
    }

    private final class PagingIterator implements Iterator<AuditLog> {

        private final AuditQuery query;
        private final int pageSize;
        private Iterator<AuditLog> current = Collections.emptyIterator();
        private String nextToken;
        private boolean exhausted;

        private PagingIterator(AuditQuery query, int pageSize) {
            this.query = query;
            this.pageSize = pageSize;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && !exhausted) {
                AuditPage page = query(query, nextToken, pageSize);
                current = page.entries().iterator();
                nextToken = page.nextPageToken();
                exhausted = !page.hasNext();
            }
            return current.hasNext();
        }

        @Override
        public AuditLog next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
