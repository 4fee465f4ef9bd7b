package com.credwallet.backend.modules.credential.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;

import com.credwallet.backend.modules.credential.domain.Credential;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CredentialRepository extends JpaRepository<Credential, Long> {

    List<Credential> findByOwnerIdOrderByIdAsc(Long ownerId);

    long countByOwnerId(Long ownerId);

    /**
     * Credentials the user owns or holds a share on that is effective at {@code now}.
     */
    @Query("""
            select c
              from Credential c
             where c.ownerId = :userId
                or exists (
                    select 1
                      from Share s
                     where s.credentialId = c.id
                       and s.granteeId = :userId
                       and (s.expiresAt is null or s.expiresAt > :now)
                )
             order by c.id
            """)
    List<Credential> findAccessibleByUser(@Param("userId") Long userId, @Param("now") OffsetDateTime now);
}
