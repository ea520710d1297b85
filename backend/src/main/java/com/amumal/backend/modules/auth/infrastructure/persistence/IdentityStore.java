package com.amumal.backend.modules.auth.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

import com.amumal.backend.global.transaction.TransactionScope;
import com.amumal.backend.modules.auth.domain.UserAccount;
import com.amumal.backend.modules.auth.domain.UserAccountColumn;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Component;

/**
 * 계정 저장소 접근 창구. 모든 메서드는 진행 중인 원자 단위의 {@link TransactionScope}를 요구하므로
 * 쓰기 직후의 조회도 같은 트랜잭션 안에서 수행된다.
 */
@Component
public class IdentityStore {

    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    public IdentityStore(UserAccountRepository userAccountRepository, Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.clock = clock;
    }

    public Optional<UserAccount> findActiveByEmail(TransactionScope scope, String email) {
        scope.ensureActive();
        return userAccountRepository.findByEmailAndDeletedAtIsNull(email);
    }

    public Optional<UserAccount> findActiveById(TransactionScope scope, long id) {
        scope.ensureActive();
        return userAccountRepository.findByIdAndDeletedAtIsNull(id);
    }

    /**
     * 탈퇴 계정까지 포함해 조회한다.
     */
    public Optional<UserAccount> findById(TransactionScope scope, long id) {
        scope.ensureActive();
        return userAccountRepository.findById(id);
    }

    public boolean isEmailTaken(TransactionScope scope, String email, Long excludingId) {
        scope.ensureActive();
        return excludingId == null
                ? userAccountRepository.existsByEmailAndDeletedAtIsNull(email)
                : userAccountRepository.existsByEmailAndDeletedAtIsNullAndIdNot(email, excludingId);
    }

    public boolean isNicknameTaken(TransactionScope scope, String nickname, Long excludingId) {
        scope.ensureActive();
        return excludingId == null
                ? userAccountRepository.existsByNicknameAndDeletedAtIsNull(nickname)
                : userAccountRepository.existsByNicknameAndDeletedAtIsNullAndIdNot(nickname, excludingId);
    }

    public UserAccount insert(TransactionScope scope, UserAccount account) {
        scope.ensureWritable();
        return userAccountRepository.saveAndFlush(account);
    }

    /**
     * 허용 목록 컬럼만 갱신한 뒤 같은 트랜잭션에서 다시 읽은 계정을 돌려준다.
     * 대상이 활성 계정이 아니면 빈 값을 반환한다.
     */
    public Optional<UserAccount> updateFields(TransactionScope scope, long id, Map<UserAccountColumn, ?> values) {
        scope.ensureWritable();
        int updated = userAccountRepository.updateColumns(id, values, OffsetDateTime.now(clock));
        if (updated == 0) {
            return Optional.empty();
        }
        return Optional.of(reload(scope, id));
    }

    /**
     * 비밀번호 해시가 확인 시점과 같을 때만 갱신한다. 그 사이 다른 요청이 먼저 바꿨거나
     * 계정이 탈퇴했다면 빈 값을 반환한다.
     */
    public Optional<UserAccount> updateFieldsIfPasswordHash(TransactionScope scope, long id, String expectedPasswordHash,
                                                            Map<UserAccountColumn, ?> values) {
        scope.ensureWritable();
        int updated = userAccountRepository.updateColumnsIfPasswordHash(id, values, expectedPasswordHash,
                OffsetDateTime.now(clock));
        if (updated == 0) {
            return Optional.empty();
        }
        return Optional.of(reload(scope, id));
    }

    public boolean markWithdrawn(TransactionScope scope, long id, String anonymizedEmail, String anonymizedNickname,
                                 String passwordMarker) {
        scope.ensureWritable();
        return userAccountRepository.markWithdrawn(id, anonymizedEmail, anonymizedNickname, passwordMarker,
                OffsetDateTime.now(clock)) == 1;
    }

    private UserAccount reload(TransactionScope scope, long id) {
        EntityManager entityManager = scope.entityManager();
        UserAccount account = entityManager.find(UserAccount.class, id);
        if (account == null) {
            throw new IllegalStateException("Updated account " + id + " is not visible in its own transaction");
        }
        entityManager.refresh(account);
        return account;
    }
}
