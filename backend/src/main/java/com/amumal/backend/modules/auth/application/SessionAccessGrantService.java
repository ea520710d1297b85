package com.amumal.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.amumal.backend.global.config.AuthProperties;
import com.amumal.backend.global.transaction.TransactionScope;
import com.amumal.backend.global.transaction.TransactionalWriteCoordinator;
import com.amumal.backend.modules.auth.domain.AuthFailureReason;
import com.amumal.backend.modules.auth.domain.UserSession;
import com.amumal.backend.modules.auth.infrastructure.persistence.CredentialStore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 서버 세션 방식 access grant. 불투명 비밀값의 해시를 user_session에 저장하고 요청마다 조회한다.
 * 로그아웃, 비밀번호 변경, 탈퇴 시 즉시 무효화할 수 있다.
 */
@Service
@ConditionalOnProperty(prefix = "app.auth", name = "access-mode", havingValue = "session")
public class SessionAccessGrantService implements CredentialValidator, AccessGrantMinter {

    private final CredentialStore credentialStore;
    private final TransactionalWriteCoordinator coordinator;
    private final long accessTtlSeconds;
    private final Clock clock;

    public SessionAccessGrantService(
            CredentialStore credentialStore,
            TransactionalWriteCoordinator coordinator,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.coordinator = coordinator;
        this.accessTtlSeconds = authProperties.accessTtl().toSeconds();
        this.clock = clock;
    }

    @Override
    public AccessGrant mint(TransactionScope scope, long userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plusSeconds(accessTtlSeconds);
        String secret = CredentialSecrets.generate(CredentialSecrets.SESSION_SECRET_BYTES);
        credentialStore.saveSession(scope, new UserSession(userId, CredentialSecrets.sha256Hex(secret), expiresAt, now));
        return new AccessGrant(secret, expiresAt, accessTtlSeconds);
    }

    @Override
    public long validate(String accessGrant) {
        if (!StringUtils.hasText(accessGrant)) {
            throw new CredentialRejectedException(AuthFailureReason.MALFORMED);
        }
        String hash = CredentialSecrets.sha256Hex(accessGrant);
        Optional<UserSession> session = coordinator.read(scope -> credentialStore.findSession(scope, hash));
        if (session.isEmpty()) {
            throw new CredentialRejectedException(AuthFailureReason.NOT_FOUND);
        }
        if (session.get().isExpiredAt(OffsetDateTime.now(clock))) {
            throw new CredentialRejectedException(AuthFailureReason.EXPIRED);
        }
        return session.get().getUserId();
    }

    @Override
    public void revoke(TransactionScope scope, String accessGrant) {
        if (StringUtils.hasText(accessGrant)) {
            credentialStore.deleteSession(scope, CredentialSecrets.sha256Hex(accessGrant));
        }
    }

    @Override
    public void revokeAll(TransactionScope scope, long userId) {
        credentialStore.deleteSessionsOf(scope, userId);
    }
}
