package com.amumal.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.function.Consumer;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.global.transaction.AtomicUnit;
import com.amumal.backend.global.transaction.TransactionScope;
import com.amumal.backend.global.transaction.TransactionalWriteCoordinator;
import com.amumal.backend.modules.auth.domain.RefreshToken;
import com.amumal.backend.modules.auth.domain.RotatedRefreshToken;
import com.amumal.backend.modules.auth.domain.UserAccount;
import com.amumal.backend.modules.auth.infrastructure.persistence.CredentialStore;
import com.amumal.backend.modules.auth.infrastructure.persistence.IdentityStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TokenIssuerTest {

    private static final Instant NOW_INSTANT = Instant.parse("2026-03-01T09:00:00Z");
    private static final OffsetDateTime NOW = OffsetDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);
    private static final long USER_ID = 7L;

    @Mock
    TransactionalWriteCoordinator coordinator;

    @Mock
    CredentialStore credentialStore;

    @Mock
    IdentityStore identityStore;

    @Mock
    AccessGrantMinter accessGrantMinter;

    private final TransactionScope scope = mock(TransactionScope.class);
    private TokenIssuer tokenIssuer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        tokenIssuer = new TokenIssuer(coordinator, credentialStore, identityStore, accessGrantMinter,
                PasswordPolicyTest.AUTH_PROPERTIES, Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));
        lenient().when(coordinator.runAtomic(any()))
                .thenAnswer(invocation -> invocation.<AtomicUnit<Object>>getArgument(0).execute(scope));
        lenient().doAnswer(invocation -> {
            invocation.<Consumer<TransactionScope>>getArgument(0).accept(scope);
            return null;
        }).when(coordinator).runAtomicVoid(any());
        lenient().when(accessGrantMinter.mint(eq(scope), anyLong()))
                .thenAnswer(invocation -> new AccessGrant("grant-" + invocation.getArgument(1), NOW.plusMinutes(30), 1800));
    }

    private RefreshToken storedToken(String secret, OffsetDateTime expiresAt) {
        RefreshToken token = new RefreshToken(USER_ID, CredentialSecrets.sha256Hex(secret), expiresAt, NOW.minusDays(1));
        when(credentialStore.findRefreshToken(scope, CredentialSecrets.sha256Hex(secret))).thenReturn(Optional.of(token));
        return token;
    }

    @Test
    void issueStoresOnlyTheHashOfTheRenewalSecret() {
        IssuedCredentials credentials = tokenIssuer.issue(USER_ID);

        ArgumentCaptor<RefreshToken> saved = ArgumentCaptor.forClass(RefreshToken.class);
        verify(credentialStore).saveRefreshToken(eq(scope), saved.capture());
        assertThat(saved.getValue().getTokenHash())
                .isEqualTo(CredentialSecrets.sha256Hex(credentials.renewalSecret()))
                .isNotEqualTo(credentials.renewalSecret());
        assertThat(saved.getValue().getExpiresAt()).isEqualTo(NOW.plusDays(7));
        assertThat(credentials.renewalSecret()).hasSize(86);
        assertThat(credentials.accessGrant().value()).isEqualTo("grant-7");
    }

    @Test
    @DisplayName("회전은 이전 레코드를 지우고 흔적을 남긴 뒤 새 자격증명을 발급한다")
    void rotateReplacesTheRenewalSecret() {
        storedToken("old-secret", NOW.plusDays(3));
        when(identityStore.findActiveById(scope, USER_ID))
                .thenReturn(Optional.of(new UserAccount("a@example.com", "alice", "hash", null)));
        when(credentialStore.deleteRefreshToken(scope, CredentialSecrets.sha256Hex("old-secret"))).thenReturn(1);

        IssuedCredentials rotated = tokenIssuer.rotate("old-secret");

        assertThat(rotated.userId()).isEqualTo(USER_ID);
        assertThat(rotated.renewalSecret()).isNotEqualTo("old-secret");
        ArgumentCaptor<RotatedRefreshToken> tombstone = ArgumentCaptor.forClass(RotatedRefreshToken.class);
        verify(credentialStore).saveTombstone(eq(scope), tombstone.capture());
        assertThat(tombstone.getValue().getTokenHash()).isEqualTo(CredentialSecrets.sha256Hex("old-secret"));
        assertThat(tombstone.getValue().getExpiresAt()).isEqualTo(NOW.plusDays(3));
        verify(credentialStore).saveRefreshToken(eq(scope), any(RefreshToken.class));
        verify(credentialStore, never()).deleteRefreshTokensOf(any(), anyLong());
    }

    @Test
    @DisplayName("이미 회전된 비밀값을 다시 쓰면 계정의 모든 자격증명이 폐기된다")
    void reuseOfRotatedSecretRevokesEverything() {
        String hash = CredentialSecrets.sha256Hex("rotated-secret");
        when(credentialStore.findRefreshToken(scope, hash)).thenReturn(Optional.empty());
        when(credentialStore.findTombstone(scope, hash))
                .thenReturn(Optional.of(new RotatedRefreshToken(hash, USER_ID, NOW.minusMinutes(5), NOW.plusDays(2))));

        assertThatThrownBy(() -> tokenIssuer.rotate("rotated-secret"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ErrorCategory.UNAUTHENTICATED));

        verify(credentialStore).deleteRefreshTokensOf(scope, USER_ID);
        verify(accessGrantMinter).revokeAll(scope, USER_ID);
    }

    @Test
    @DisplayName("동시 회전에서 삭제 행 수가 0이면 재사용으로 판단한다")
    void losingConcurrentRotationIsTreatedAsReuse() {
        storedToken("raced-secret", NOW.plusDays(3));
        when(identityStore.findActiveById(scope, USER_ID))
                .thenReturn(Optional.of(new UserAccount("a@example.com", "alice", "hash", null)));
        when(credentialStore.deleteRefreshToken(scope, CredentialSecrets.sha256Hex("raced-secret"))).thenReturn(0);

        assertThatThrownBy(() -> tokenIssuer.rotate("raced-secret")).isInstanceOf(ProblemException.class);

        verify(credentialStore, never()).saveTombstone(any(), any());
        verify(credentialStore, never()).saveRefreshToken(any(), any());
        verify(credentialStore).deleteRefreshTokensOf(scope, USER_ID);
    }

    @Test
    void expiredSecretIsDeletedWithoutRevokingOthers() {
        storedToken("stale-secret", NOW.minusSeconds(1));

        assertThatThrownBy(() -> tokenIssuer.rotate("stale-secret")).isInstanceOf(ProblemException.class);

        verify(credentialStore).deleteRefreshToken(scope, CredentialSecrets.sha256Hex("stale-secret"));
        verify(credentialStore, never()).deleteRefreshTokensOf(any(), anyLong());
        verify(credentialStore, never()).saveRefreshToken(any(), any());
    }

    @Test
    void secretOfWithdrawnAccountIsRejected() {
        storedToken("orphan-secret", NOW.plusDays(1));
        when(identityStore.findActiveById(scope, USER_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tokenIssuer.rotate("orphan-secret")).isInstanceOf(ProblemException.class);

        verify(credentialStore).deleteRefreshToken(scope, CredentialSecrets.sha256Hex("orphan-secret"));
        verify(credentialStore, never()).saveRefreshToken(any(), any());
    }

    @Test
    void unknownSecretIsRejectedWithoutSideEffects() {
        String hash = CredentialSecrets.sha256Hex("never-issued");
        when(credentialStore.findRefreshToken(scope, hash)).thenReturn(Optional.empty());
        when(credentialStore.findTombstone(scope, hash)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tokenIssuer.rotate("never-issued")).isInstanceOf(ProblemException.class);

        verify(credentialStore, never()).deleteRefreshTokensOf(any(), anyLong());
        verify(coordinator, never()).runAtomicVoid(any());
    }

    @Test
    void expiredTombstoneIsNotTreatedAsReuse() {
        String hash = CredentialSecrets.sha256Hex("ancient-secret");
        when(credentialStore.findRefreshToken(scope, hash)).thenReturn(Optional.empty());
        when(credentialStore.findTombstone(scope, hash))
                .thenReturn(Optional.of(new RotatedRefreshToken(hash, USER_ID, NOW.minusDays(8), NOW.minusDays(1))));

        assertThatThrownBy(() -> tokenIssuer.rotate("ancient-secret")).isInstanceOf(ProblemException.class);

        verify(credentialStore, never()).deleteRefreshTokensOf(any(), anyLong());
    }

    @Test
    void blankSecretNeverReachesStorage() {
        assertThatThrownBy(() -> tokenIssuer.rotate("  ")).isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> tokenIssuer.rotate(null)).isInstanceOf(ProblemException.class);

        verifyNoInteractions(credentialStore);
    }

    @Test
    void revokeIgnoresMissingSecret() {
        tokenIssuer.revoke((String) null);
        tokenIssuer.revoke("gone-secret");

        verify(credentialStore).deleteRefreshToken(scope, CredentialSecrets.sha256Hex("gone-secret"));
        verify(accessGrantMinter, never()).revoke(any(), anyString());
    }
}
