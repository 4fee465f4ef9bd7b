package com.credwallet.backend.modules.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import com.credwallet.backend.global.error.VaultErrorKind;
import com.credwallet.backend.global.error.VaultException;
import com.credwallet.backend.modules.audit.domain.AuditActions;
import com.credwallet.backend.modules.audit.domain.AuditLog;
import com.credwallet.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.credwallet.backend.modules.credential.application.CredentialService;
import com.credwallet.backend.modules.credential.infrastructure.persistence.CredentialRepository;
import com.credwallet.backend.modules.identity.application.IdentityService;
import com.credwallet.backend.modules.identity.domain.VaultUser;
import com.credwallet.backend.modules.identity.infrastructure.persistence.VaultUserRepository;
import com.credwallet.backend.modules.share.application.ShareService;
import com.credwallet.backend.modules.share.infrastructure.persistence.ShareRepository;
import com.credwallet.backend.modules.verification.application.EkycService;
import com.credwallet.backend.modules.verification.infrastructure.persistence.EkycSessionRepository;
import com.credwallet.backend.support.AbstractPostgresIntegrationTest;
import com.credwallet.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class UserDeletionIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private IdentityService identityService;

    @Autowired
    private CredentialService credentialService;

    @Autowired
    private ShareService shareService;

    @Autowired
    private EkycService ekycService;

    @Autowired
    private VaultUserRepository vaultUserRepository;

    @Autowired
    private CredentialRepository credentialRepository;

    @Autowired
    private ShareRepository shareRepository;

    @Autowired
    private EkycSessionRepository ekycSessionRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void deletingUserCascadesAndKeepsAnonymousAuditTrail() {
        VaultUser alice = testUserFactory.createUser("alice");
        VaultUser bob = testUserFactory.createUser("bob");
        Long aliceCredential = credentialService.create(alice.getId(), "bank-pin", null, new byte[]{1}, null).getId();
        Long bobCredential = credentialService.create(bob.getId(), "router", null, new byte[]{2}, null).getId();
        shareService.grant(aliceCredential, alice.getId(), bob.getId(), "read", null);
        shareService.grant(bobCredential, bob.getId(), alice.getId(), "write", null);
        ekycService.start(alice.getId(), "acme-kyc");

        identityService.delete(alice.getId(), alice.getId());

        assertThat(vaultUserRepository.findById(alice.getId())).isEmpty();
        assertThat(credentialRepository.findByOwnerIdOrderByIdAsc(alice.getId())).isEmpty();
        assertThat(shareRepository.findByCredentialIdOrderByIdAsc(aliceCredential)).isEmpty();
        assertThat(shareRepository.findByGranteeIdOrderByIdAsc(alice.getId())).isEmpty();
        assertThat(ekycSessionRepository.findByUserIdOrderByIdAsc(alice.getId())).isEmpty();

        assertThat(credentialRepository.findById(bobCredential)).isPresent();
        assertThat(credentialService.listForUser(bob.getId())).hasSize(1);

        List<AuditLog> aliceCreates = auditLogRepository.findByResourceTypeAndResourceIdOrderByIdAsc(
                AuditActions.RESOURCE_CREDENTIAL, aliceCredential);
        assertThat(aliceCreates).extracting(AuditLog::getAction).containsExactly(AuditActions.CREDENTIAL_CREATE);
        assertThat(aliceCreates).allSatisfy(entry -> assertThat(entry.getActorId()).isNull());

        assertThat(auditLogRepository.findByActionOrderByIdAsc(AuditActions.USER_DELETE))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getResourceId()).isEqualTo(alice.getId());
                    assertThat(entry.getActorId()).isNull();
                });
    }

    @Test
    void deactivatedUserLosesAccessButKeepsData() {
        VaultUser alice = testUserFactory.createUser("alice");
        Long credentialId = credentialService.create(alice.getId(), "bank-pin", null, new byte[]{1}, null).getId();

        identityService.deactivate(alice.getId(), alice.getId());

        assertThatThrownBy(() -> credentialService.get(credentialId, alice.getId()))
                .isInstanceOfSatisfying(VaultException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(VaultErrorKind.PERMISSION_DENIED));
        assertThat(credentialRepository.findById(credentialId)).isPresent();
    }

    @Test
    void adminMayDeleteAnotherUser() {
        VaultUser admin = testUserFactory.createAdmin("root");
        VaultUser bob = testUserFactory.createUser("bob");

        identityService.delete(bob.getId(), admin.getId());

        assertThat(vaultUserRepository.findById(bob.getId())).isEmpty();
        assertThat(auditLogRepository.findByActionOrderByIdAsc(AuditActions.USER_DELETE))
                .singleElement()
                .satisfies(entry -> assertThat(entry.getActorId()).isEqualTo(admin.getId()));
    }
}
