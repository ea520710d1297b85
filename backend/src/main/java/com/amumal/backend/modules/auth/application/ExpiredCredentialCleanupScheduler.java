package com.amumal.backend.modules.auth.application;

import com.amumal.backend.modules.auth.infrastructure.persistence.CredentialStore.ExpiredCredentialCounts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ExpiredCredentialCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExpiredCredentialCleanupScheduler.class);

    private final TokenIssuer tokenIssuer;

    public ExpiredCredentialCleanupScheduler(TokenIssuer tokenIssuer) {
        this.tokenIssuer = tokenIssuer;
    }

    @Scheduled(fixedDelayString = "${app.auth.cleanup-interval:PT1H}", initialDelayString = "${app.auth.cleanup-initial-delay:PT5M}")
    public void purgeExpiredCredentials() {
        ExpiredCredentialCounts counts = tokenIssuer.purgeExpired();
        if (counts.total() > 0) {
            log.info("Purged expired credentials: refreshTokens={}, tombstones={}, sessions={}",
                    counts.refreshTokens(), counts.tombstones(), counts.sessions());
        }
    }
}
