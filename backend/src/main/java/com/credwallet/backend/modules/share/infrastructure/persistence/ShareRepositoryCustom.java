package com.credwallet.backend.modules.share.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.credwallet.backend.modules.share.domain.Share;
import com.credwallet.backend.modules.share.domain.SharePermission;

public interface ShareRepositoryCustom {

    /**
     * Inserts the grant or, when one already exists for the (credential, grantee) pair,
     * replaces its permission and expiry. {@code createdAt} only applies to a new row.
     */
    Share upsert(Long credentialId, Long granteeId, SharePermission permission, OffsetDateTime expiresAt, OffsetDateTime createdAt);
}
