package com.credwallet.backend.modules.share.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.credwallet.backend.global.config.VaultProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "vault.shares.purge", name = "enabled", havingValue = "true")
public class ExpiredSharePurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExpiredSharePurgeScheduler.class);

    private final ShareService shareService;
    private final VaultProperties.Purge purgeProperties;
    private final Clock clock;

    public ExpiredSharePurgeScheduler(ShareService shareService, VaultProperties vaultProperties, Clock clock) {
        this.shareService = shareService;
        this.purgeProperties = vaultProperties.shares().purge();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${vault.shares.purge.interval:PT1H}")
    public void purgeExpiredShares() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(purgeProperties.retention());
        int purged = shareService.purgeExpired(cutoff);
        if (purged > 0) {
            log.info("Purged {} shares expired before {}", purged, cutoff);
        }
    }
}
