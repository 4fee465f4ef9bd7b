package com.credwallet.backend.modules.identity.infrastructure.persistence;

import java.util.Optional;

import com.credwallet.backend.modules.identity.domain.VaultUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VaultUserRepository extends JpaRepository<VaultUser, Long> {

    Optional<VaultUser> findByEmail(String email);

    @Query("select u from VaultUser u where u.id = :id and u.active = true")
    Optional<VaultUser> findActiveById(@Param("id") Long id);

    /**
     * Removes the row directly so the store's ON DELETE rules cascade to credentials,
     * shares and eKYC sessions and null the audit actor in one statement.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from VaultUser u where u.id = :id")
    int deleteByIdCascading(@Param("id") Long id);
}
