package com.credwallet.backend.modules.verification.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.credwallet.backend.modules.verification.domain.EkycSession;

import org.springframework.data.jpa.repository.JpaRepository;

public interface EkycSessionRepository extends JpaRepository<EkycSession, Long> {

    Optional<EkycSession> findFirstByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    List<EkycSession> findByUserIdOrderByIdAsc(Long userId);
}
