package com.credwallet.backend.modules.audit.application;

import static com.credwallet.backend.support.EntityIds.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import com.credwallet.backend.global.config.VaultProperties;
import com.credwallet.backend.global.error.VaultErrorKind;
import com.credwallet.backend.global.error.VaultException;
import com.credwallet.backend.modules.audit.domain.AuditActions;
import com.credwallet.backend.modules.audit.domain.AuditLog;
import com.credwallet.backend.modules.audit.domain.AuditRecord;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditCursor;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditQuery;
import com.credwallet.backend.modules.identity.domain.VaultUser;

import jakarta.persistence.EntityManager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class AuditTrailServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private AuditLogRepository auditLogRepository;

    @Mock
    private EntityManager entityManager;

    private Clock clock;
    private AuditTrailService auditTrailService;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        auditTrailService = newService(false, 3);
    }

    private AuditTrailService newService(boolean recordQueries, int maxPageSize) {
        VaultProperties properties = new VaultProperties(
                new VaultProperties.Audit(false, recordQueries, maxPageSize),
                new VaultProperties.Shares(new VaultProperties.Purge(false, Duration.ofDays(30), Duration.ofHours(1)))
        );
        return new AuditTrailService(auditLogRepository, entityManager, clock, properties);
    }

    private static AuditLog entry(long id, OffsetDateTime createdAt) {
        return withId(AuditLog.of(AuditRecord.of(1L, AuditActions.CREDENTIAL_CREATE, AuditActions.RESOURCE_CREDENTIAL, id), null, createdAt), id);
    }

    private static List<AuditLog> entries(long fromId, long toIdInclusive) {
        return LongStream.rangeClosed(fromId, toIdInclusive)
                .map(id -> -id)
                .sorted()
                .map(id -> -id)
                .mapToObj(id -> entry(id, NOW.minusMinutes(100 - id)))
                .collect(Collectors.toList());
    }

    @Test
    void appendStampsClockAndActorReference() {
        VaultUser actor = withId(new VaultUser(), 7L);
        when(entityManager.getReference(VaultUser.class, 7L)).thenReturn(actor);
        when(auditLogRepository.save(any(AuditLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuditLog saved = auditTrailService.append(
                AuditRecord.of(7L, AuditActions.SHARE_GRANT, AuditActions.RESOURCE_SHARE, 5L).withOrigin("10.0.0.1", "curl/8"));

        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        assertThat(saved.getActorId()).isEqualTo(7L);
        assertThat(saved.getIpAddress()).isEqualTo("10.0.0.1");
        assertThat(saved.getUserAgent()).isEqualTo("curl/8");
    }

    @Test
    @DisplayName("entry timestamps keep microsecond precision only")
    void appendTruncatesToMicroseconds() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00.123456789Z").toInstant(), ZoneOffset.UTC);
        auditTrailService = newService(false, 3);
        when(auditLogRepository.save(any(AuditLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuditLog saved = auditTrailService.append(
                AuditRecord.of(null, AuditActions.SHARE_PURGE, AuditActions.RESOURCE_SHARE, 5L));

        assertThat(saved.getCreatedAt()).isEqualTo(OffsetDateTime.parse("2025-01-01T00:00:00.123456Z"));
    }

    @Test
    void systemEntriesHaveNoActor() {
        when(auditLogRepository.save(any(AuditLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuditLog saved = auditTrailService.append(null, AuditActions.SHARE_PURGE, AuditActions.RESOURCE_SHARE, 5L);

        assertThat(saved.getActorId()).isNull();
        assertThat(saved.getIpAddress()).isNull();
        verify(entityManager, never()).getReference(any(), any());
    }

    @Test
    @DisplayName("a store failure on append propagates to the caller")
    void appendFailurePropagates() {
        when(auditLogRepository.save(any(AuditLog.class))).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> auditTrailService.append(null, AuditActions.SHARE_PURGE, null, null))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @DisplayName("a full page carries a token that resumes after its last entry")
    void fullPageCarriesResumeToken() {
        List<AuditLog> rows = entries(7, 10);
        when(auditLogRepository.search(AuditQuery.all(), null, 4)).thenReturn(rows);

        AuditPage first = auditTrailService.query(AuditQuery.all(), null, 3);

        assertThat(first.entries()).extracting(AuditLog::getId).containsExactly(10L, 9L, 8L);
        assertThat(first.hasNext()).isTrue();

        AuditCursor resumeAfter = AuditPageToken.decode(first.nextPageToken());
        assertThat(resumeAfter.id()).isEqualTo(8L);
        assertThat(resumeAfter.createdAt().toInstant()).isEqualTo(rows.get(2).getCreatedAt().toInstant());

        when(auditLogRepository.search(AuditQuery.all(), resumeAfter, 4)).thenReturn(rows.subList(3, 4));
        AuditPage second = auditTrailService.query(AuditQuery.all(), first.nextPageToken(), 3);

        assertThat(second.entries()).extracting(AuditLog::getId).containsExactly(7L);
        assertThat(second.hasNext()).isFalse();
    }

    @Test
    void pageSizeIsClampedToConfiguredMaximum() {
        when(auditLogRepository.search(AuditQuery.all(), null, 4)).thenReturn(List.of());

        AuditPage page = auditTrailService.query(AuditQuery.all(), null, 10_000);

        assertThat(page.entries()).isEmpty();
        assertThat(page.nextPageToken()).isNull();
    }

    @Test
    void malformedTokenIsInvalidArgument() {
        assertThatThrownBy(() -> auditTrailService.query(AuditQuery.all(), "not-a-token!", 3))
                .isInstanceOfSatisfying(VaultException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(VaultErrorKind.INVALID_ARGUMENT));
        verify(auditLogRepository, never()).search(any(), any(), anyInt());
    }

    @Test
    void queryAsRecordsTheLookupWhenEnabled() {
        auditTrailService = newService(true, 3);
        AuditQuery query = AuditQuery.forUser(7L);
        when(auditLogRepository.save(any(AuditLog.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(entityManager.getReference(VaultUser.class, 7L)).thenReturn(withId(new VaultUser(), 7L));
        when(auditLogRepository.search(query, null, 4)).thenReturn(List.of());

        auditTrailService.queryAs(7L, query, null, 3);

        ArgumentCaptor<AuditLog> saved = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(saved.capture());
        assertThat(saved.getValue().getAction()).isEqualTo(AuditActions.AUDIT_QUERY);
    }

    @Test
    void queryAsIsSilentByDefault() {
        when(auditLogRepository.search(AuditQuery.all(), null, 4)).thenReturn(List.of());

        auditTrailService.queryAs(7L, AuditQuery.all(), null, 3);

        verify(auditLogRepository, never()).save(any());
    }

    @Test
    @DisplayName("stream fetches pages only as they are consumed")
    void streamIsLazy() {
        List<AuditLog> rows = entries(1, 7);
        when(auditLogRepository.search(AuditQuery.all(), null, 4)).thenReturn(rows.subList(0, 4));

        List<Long> firstTwo = auditTrailService.stream(AuditQuery.all(), 3)
                .limit(2)
                .map(AuditLog::getId)
                .toList();

        assertThat(firstTwo).containsExactly(7L, 6L);
        verify(auditLogRepository, never()).search(eq(AuditQuery.all()), any(AuditCursor.class), anyInt());
    }

    @Test
    void streamWalksEveryPage() {
        List<AuditLog> rows = entries(1, 5);
        when(auditLogRepository.search(AuditQuery.all(), null, 3)).thenReturn(rows.subList(0, 3));
        when(auditLogRepository.search(eq(AuditQuery.all()), any(AuditCursor.class), eq(3)))
                .thenReturn(rows.subList(2, 5), rows.subList(4, 5));

        List<Long> ids = auditTrailService.stream(AuditQuery.all(), 2)
                .map(AuditLog::getId)
                .toList();

        assertThat(ids).containsExactly(5L, 4L, 3L, 2L, 1L);
        verify(auditLogRepository, never()).search(any(), isNull(), eq(4));
    }
}
