package com.amumal.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.amumal.backend.global.transaction.TransactionalWriteCoordinator;
import com.amumal.backend.modules.auth.application.CredentialSecrets;
import com.amumal.backend.modules.auth.application.TokenIssuer;
import com.amumal.backend.modules.auth.domain.RefreshToken;
import com.amumal.backend.modules.auth.domain.RotatedRefreshToken;
import com.amumal.backend.modules.auth.domain.UserAccount;
import com.amumal.backend.modules.auth.infrastructure.persistence.CredentialStore.ExpiredCredentialCounts;
import com.amumal.backend.modules.auth.infrastructure.persistence.IdentityStore;
import com.amumal.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.amumal.backend.modules.auth.infrastructure.persistence.RotatedRefreshTokenRepository;
import com.amumal.backend.support.AbstractPostgresIntegrationTest;
import com.amumal.backend.support.TestAccounts;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ExpiredCredentialCleanupIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private TokenIssuer tokenIssuer;

    @Autowired
    private TransactionalWriteCoordinator coordinator;

    @Autowired
    private IdentityStore identityStore;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private RotatedRefreshTokenRepository rotatedRefreshTokenRepository;

    @Test
    void purgeRemovesOnlyExpiredCredentials() {
        long userId = coordinator.runAtomic(scope -> identityStore.insert(scope,
                new UserAccount(TestAccounts.uniqueEmail(), TestAccounts.uniqueNickname(), "hash", null))).getId();
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        String expiredHash = CredentialSecrets.sha256Hex("expired-" + userId);
        String liveHash = CredentialSecrets.sha256Hex("live-" + userId);
        String staleTombstone = CredentialSecrets.sha256Hex("tombstone-" + userId);
        refreshTokenRepository.save(new RefreshToken(userId, expiredHash, now.minusMinutes(1), now.minusDays(8)));
        refreshTokenRepository.save(new RefreshToken(userId, liveHash, now.plusDays(1), now));
        rotatedRefreshTokenRepository.save(new RotatedRefreshToken(staleTombstone, userId, now.minusDays(8), now.minusDays(1)));

        ExpiredCredentialCounts counts = tokenIssuer.purgeExpired();

        assertThat(counts.refreshTokens()).isGreaterThanOrEqualTo(1);
        assertThat(counts.tombstones()).isGreaterThanOrEqualTo(1);
        assertThat(refreshTokenRepository.findByTokenHash(expiredHash)).isEmpty();
        assertThat(refreshTokenRepository.findByTokenHash(liveHash)).isPresent();
        assertThat(rotatedRefreshTokenRepository.findById(staleTombstone)).isEmpty();
    }
}
