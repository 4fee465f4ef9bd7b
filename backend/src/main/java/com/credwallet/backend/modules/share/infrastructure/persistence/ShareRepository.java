package com.credwallet.backend.modules.share.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.credwallet.backend.modules.share.domain.Share;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ShareRepository extends JpaRepository<Share, Long>, ShareRepositoryCustom {

    Optional<Share> findByCredentialIdAndGranteeId(Long credentialId, Long granteeId);

    List<Share> findByCredentialIdOrderByIdAsc(Long credentialId);

    List<Share> findByGranteeIdOrderByIdAsc(Long granteeId);

    long countByCredentialIdAndGranteeId(Long credentialId, Long granteeId);

    @Query("""
            select s
              from Share s
             where s.credentialId = :credentialId
               and s.granteeId = :granteeId
               and (s.expiresAt is null or s.expiresAt > :now)
            """)
    Optional<Share> findEffective(
            @Param("credentialId") Long credentialId,
            @Param("granteeId") Long granteeId,
            @Param("now") OffsetDateTime now
    );

    @Query("select s from Share s where s.expiresAt is not null and s.expiresAt <= :cutoff order by s.id")
    List<Share> findExpiredAtOrBefore(@Param("cutoff") OffsetDateTime cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Share s where s.credentialId = :credentialId")
    int deleteByCredentialId(@Param("credentialId") Long credentialId);
}
