package com.amumal.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.amumal.backend.global.transaction.TransactionScope;
import com.amumal.backend.modules.auth.domain.RefreshToken;
import com.amumal.backend.modules.auth.domain.RotatedRefreshToken;
import com.amumal.backend.modules.auth.domain.UserSession;

import org.springframework.stereotype.Component;

/**
 * 폐기 가능한 자격증명(갱신 비밀값, 회전 흔적, 서버 세션)의 영속 저장소.
 * 모든 키는 비밀값 원문이 아니라 SHA-256 해시다.
 */
@Component
public class CredentialStore {

    private final RefreshTokenRepository refreshTokenRepository;
    private final RotatedRefreshTokenRepository rotatedRefreshTokenRepository;
    private final UserSessionRepository userSessionRepository;

    public CredentialStore(
            RefreshTokenRepository refreshTokenRepository,
            RotatedRefreshTokenRepository rotatedRefreshTokenRepository,
            UserSessionRepository userSessionRepository
    ) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.rotatedRefreshTokenRepository = rotatedRefreshTokenRepository;
        this.userSessionRepository = userSessionRepository;
    }

    public Optional<RefreshToken> findRefreshToken(TransactionScope scope, String tokenHash) {
        scope.ensureActive();
        return refreshTokenRepository.findByTokenHash(tokenHash);
    }

    public Optional<RotatedRefreshToken> findTombstone(TransactionScope scope, String tokenHash) {
        scope.ensureActive();
        return rotatedRefreshTokenRepository.findById(tokenHash);
    }

    public void saveRefreshToken(TransactionScope scope, RefreshToken refreshToken) {
        scope.ensureWritable();
        scope.entityManager().persist(refreshToken);
    }

    /**
     * @return 삭제된 행 수. 동시에 같은 값을 삭제한 트랜잭션이 먼저 커밋했다면 0이다.
     */
    public int deleteRefreshToken(TransactionScope scope, String tokenHash) {
        scope.ensureWritable();
        return refreshTokenRepository.deleteByTokenHash(tokenHash);
    }

    public int deleteRefreshTokensOf(TransactionScope scope, long userId) {
        scope.ensureWritable();
        return refreshTokenRepository.deleteAllByUserId(userId);
    }

    public void saveTombstone(TransactionScope scope, RotatedRefreshToken tombstone) {
        scope.ensureWritable();
        scope.entityManager().persist(tombstone);
    }

    public int deleteTombstonesOf(TransactionScope scope, long userId) {
        scope.ensureWritable();
        return rotatedRefreshTokenRepository.deleteAllByUserId(userId);
    }

    public Optional<UserSession> findSession(TransactionScope scope, String sessionHash) {
        scope.ensureActive();
        return userSessionRepository.findBySessionHash(sessionHash);
    }

    public void saveSession(TransactionScope scope, UserSession session) {
        scope.ensureWritable();
        scope.entityManager().persist(session);
    }

    public int deleteSession(TransactionScope scope, String sessionHash) {
        scope.ensureWritable();
        return userSessionRepository.deleteBySessionHash(sessionHash);
    }

    public int deleteSessionsOf(TransactionScope scope, long userId) {
        scope.ensureWritable();
        return userSessionRepository.deleteAllByUserId(userId);
    }

    public ExpiredCredentialCounts deleteExpired(TransactionScope scope, OffsetDateTime now) {
        scope.ensureWritable();
        return new ExpiredCredentialCounts(
                refreshTokenRepository.deleteExpired(now),
                rotatedRefreshTokenRepository.deleteExpired(now),
                userSessionRepository.deleteExpired(now)
        );
    }

    public record ExpiredCredentialCounts(int refreshTokens, int tombstones, int sessions) {

        public int total() {
            return refreshTokens + tombstones + sessions;
        }
    }
}
