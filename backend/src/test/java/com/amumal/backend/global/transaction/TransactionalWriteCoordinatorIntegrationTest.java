package com.amumal.backend.global.transaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.modules.auth.domain.UserAccount;
import com.amumal.backend.modules.auth.domain.UserAccountColumn;
import com.amumal.backend.modules.auth.infrastructure.persistence.IdentityStore;
import com.amumal.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.amumal.backend.support.AbstractPostgresIntegrationTest;
import com.amumal.backend.support.TestAccounts;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class TransactionalWriteCoordinatorIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private TransactionalWriteCoordinator coordinator;

    @Autowired
    private IdentityStore identityStore;

    @Autowired
    private UserAccountRepository userAccountRepository;

    private UserAccount newAccount(String email) {
        return new UserAccount(email, TestAccounts.uniqueNickname(), "hash", null);
    }

    @Test
    @DisplayName("단위 중간에 실패하면 앞선 쓰기도 모두 롤백된다")
    void failureMidUnitLeavesNoSideEffects() {
        String email = TestAccounts.uniqueEmail();

        assertThatThrownBy(() -> coordinator.runAtomicVoid(scope -> {
            identityStore.insert(scope, newAccount(email));
            throw new IllegalStateException("boom after first write");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(userAccountRepository.findByEmailAndDeletedAtIsNull(email)).isEmpty();
    }

    @Test
    void uniqueViolationRollsBackWholeUnitAsConflict() {
        String existingEmail = TestAccounts.uniqueEmail();
        coordinator.runAtomic(scope -> identityStore.insert(scope, newAccount(existingEmail)));
        String freshEmail = TestAccounts.uniqueEmail();

        assertThatThrownBy(() -> coordinator.runAtomicVoid(scope -> {
            identityStore.insert(scope, newAccount(freshEmail));
            identityStore.insert(scope, newAccount(existingEmail));
        }))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ErrorCategory.CONFLICT));

        assertThat(userAccountRepository.findByEmailAndDeletedAtIsNull(freshEmail)).isEmpty();
        assertThat(userAccountRepository.findByEmailAndDeletedAtIsNull(existingEmail)).isPresent();
    }

    @Test
    @DisplayName("같은 단위 안에서는 커밋 전 쓰기를 다시 읽을 수 있다")
    void readYourWritesWithinUnit() {
        String email = TestAccounts.uniqueEmail();

        UserAccount reloaded = coordinator.runAtomic(scope -> {
            UserAccount saved = identityStore.insert(scope, newAccount(email));
            return identityStore.updateFields(scope, saved.getId(),
                    Map.of(UserAccountColumn.PROFILE_IMAGE_URL, "https://cdn.example.com/p.png")).orElseThrow();
        });

        assertThat(reloaded.getEmail()).isEqualTo(email);
        assertThat(reloaded.getProfileImageUrl()).isEqualTo("https://cdn.example.com/p.png");
    }

    @Test
    void markRollbackOnlyDiscardsWrites() {
        String email = TestAccounts.uniqueEmail();

        coordinator.runAtomicVoid(scope -> {
            identityStore.insert(scope, newAccount(email));
            scope.markRollbackOnly();
        });

        assertThat(userAccountRepository.findByEmailAndDeletedAtIsNull(email)).isEmpty();
    }

    @Test
    void readScopeRejectsWrites() {
        assertThatThrownBy(() -> coordinator.read(scope -> identityStore.insert(scope, newAccount(TestAccounts.uniqueEmail()))))
                .isInstanceOf(IllegalStateException.class);
    }
}
