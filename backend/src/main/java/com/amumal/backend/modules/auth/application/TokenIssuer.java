package com.amumal.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.amumal.backend.global.config.AuthProperties;
import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.global.transaction.TransactionScope;
import com.amumal.backend.global.transaction.TransactionalWriteCoordinator;
import com.amumal.backend.modules.auth.domain.AuthFailureReason;
import com.amumal.backend.modules.auth.domain.RefreshToken;
import com.amumal.backend.modules.auth.domain.RotatedRefreshToken;
import com.amumal.backend.modules.auth.infrastructure.persistence.CredentialStore;
import com.amumal.backend.modules.auth.infrastructure.persistence.CredentialStore.ExpiredCredentialCounts;
import com.amumal.backend.modules.auth.infrastructure.persistence.IdentityStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * access grant와 갱신 비밀값의 발급, 회전, 폐기.
 *
 * <p>회전은 하나의 원자 단위에서 이전 레코드 삭제(정확히 1행), 회전 흔적 기록, 새 레코드 삽입을 수행한다.
 * 같은 비밀값으로 동시에 회전하면 하나만 성공하고 나머지는 0행 삭제로 재사용을 감지한다.
 * 재사용이 감지되면 별도의 원자 단위로 해당 계정의 모든 자격증명을 폐기한다.</p>
 *
 * <p>거부 사유는 로그에만 남기고 클라이언트에는 항상 UNAUTHENTICATED로 응답한다.</p>
 */
@Service
public class TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    private final TransactionalWriteCoordinator coordinator;
    private final CredentialStore credentialStore;
    private final IdentityStore identityStore;
    private final AccessGrantMinter accessGrantMinter;
    private final Duration refreshTtl;
    private final Clock clock;

    public TokenIssuer(
            TransactionalWriteCoordinator coordinator,
            CredentialStore credentialStore,
            IdentityStore identityStore,
            AccessGrantMinter accessGrantMinter,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.coordinator = coordinator;
        this.credentialStore = credentialStore;
        this.identityStore = identityStore;
        this.accessGrantMinter = accessGrantMinter;
        this.refreshTtl = authProperties.refreshTtl();
        this.clock = clock;
    }

    public IssuedCredentials issue(long userId) {
        return coordinator.runAtomic(scope -> issue(scope, userId));
    }

    public IssuedCredentials issue(TransactionScope scope, long userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String renewalSecret = CredentialSecrets.generateRenewalSecret();
        OffsetDateTime renewalExpiresAt = now.plus(refreshTtl);
        credentialStore.saveRefreshToken(scope,
                new RefreshToken(userId, CredentialSecrets.sha256Hex(renewalSecret), renewalExpiresAt, now));
        AccessGrant accessGrant = accessGrantMinter.mint(scope, userId);
        return new IssuedCredentials(userId, accessGrant, renewalSecret, renewalExpiresAt);
    }

    public IssuedCredentials rotate(String renewalSecret) {
        if (!StringUtils.hasText(renewalSecret)) {
            log.info("Renewal rejected: {}", AuthFailureReason.NOT_FOUND);
            throw ProblemException.unauthenticated();
        }
        String tokenHash = CredentialSecrets.sha256Hex(renewalSecret);
        // 만료 레코드의 지연 삭제가 커밋되도록 거부도 예외가 아닌 결과로 돌려받는다.
        RotationOutcome outcome = coordinator.runAtomic(scope -> rotateWithin(scope, tokenHash));
        if (outcome.credentials() != null) {
            log.debug("Renewal secret rotated for user {}", outcome.userId());
            return outcome.credentials();
        }

        if (outcome.reason() == AuthFailureReason.REUSED && outcome.userId() != null) {
            long userId = outcome.userId();
            log.warn("Renewal secret reuse detected for user {}; revoking all credentials", userId);
            coordinator.runAtomicVoid(scope -> revokeAll(scope, userId));
        } else {
            log.info("Renewal rejected: {} (user={})", outcome.reason(), outcome.userId());
        }
        throw ProblemException.unauthenticated();
    }

    private RotationOutcome rotateWithin(TransactionScope scope, String tokenHash) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<RefreshToken> current = credentialStore.findRefreshToken(scope, tokenHash);
        if (current.isEmpty()) {
            return credentialStore.findTombstone(scope, tokenHash)
                    .filter(tombstone -> tombstone.getExpiresAt().isAfter(now))
                    .map(tombstone -> RotationOutcome.rejected(AuthFailureReason.REUSED, tombstone.getUserId()))
                    .orElseGet(() -> RotationOutcome.rejected(AuthFailureReason.NOT_FOUND, null));
        }

        RefreshToken token = current.get();
        long userId = token.getUserId();
        if (token.isExpiredAt(now)) {
            credentialStore.deleteRefreshToken(scope, tokenHash);
            return RotationOutcome.rejected(AuthFailureReason.EXPIRED, userId);
        }
        if (identityStore.findActiveById(scope, userId).isEmpty()) {
            credentialStore.deleteRefreshToken(scope, tokenHash);
            return RotationOutcome.rejected(AuthFailureReason.INACTIVE_ACCOUNT, userId);
        }
        if (credentialStore.deleteRefreshToken(scope, tokenHash) != 1) {
            return RotationOutcome.rejected(AuthFailureReason.REUSED, userId);
        }
        credentialStore.saveTombstone(scope, new RotatedRefreshToken(tokenHash, userId, now, token.getExpiresAt()));
        return RotationOutcome.rotated(issue(scope, userId));
    }

    /**
     * 갱신 비밀값 하나를 폐기한다. 없는 값이어도 성공으로 취급한다.
     */
    public void revoke(String renewalSecret) {
        if (!StringUtils.hasText(renewalSecret)) {
            return;
        }
        String tokenHash = CredentialSecrets.sha256Hex(renewalSecret);
        coordinator.runAtomicVoid(scope -> credentialStore.deleteRefreshToken(scope, tokenHash));
    }

    public void revoke(TransactionScope scope, String renewalSecret, String accessGrant) {
        if (StringUtils.hasText(renewalSecret)) {
            credentialStore.deleteRefreshToken(scope, CredentialSecrets.sha256Hex(renewalSecret));
        }
        accessGrantMinter.revoke(scope, accessGrant);
    }

    /**
     * 계정의 모든 갱신 비밀값과 서버 세션을 폐기한다. 회전 흔적은 재사용 감지를 위해 남긴다.
     */
    public void revokeAll(TransactionScope scope, long userId) {
        int revoked = credentialStore.deleteRefreshTokensOf(scope, userId);
        accessGrantMinter.revokeAll(scope, userId);
        log.info("Revoked {} renewal secrets for user {}", revoked, userId);
    }

    public ExpiredCredentialCounts purgeExpired() {
        return coordinator.runAtomic(scope -> credentialStore.deleteExpired(scope, OffsetDateTime.now(clock)));
    }

    private record RotationOutcome(IssuedCredentials credentials, AuthFailureReason reason, Long userId) {

        static RotationOutcome rotated(IssuedCredentials credentials) {
            return new RotationOutcome(credentials, null, credentials.userId());
        }

        static RotationOutcome rejected(AuthFailureReason reason, Long userId) {
            return new RotationOutcome(null, reason, userId);
        }
    }
}
