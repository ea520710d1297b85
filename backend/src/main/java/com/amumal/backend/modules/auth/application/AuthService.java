package com.amumal.backend.modules.auth.application;

import java.util.Locale;
import java.util.Optional;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.global.transaction.TransactionalWriteCoordinator;
import com.amumal.backend.modules.auth.domain.UserAccount;
import com.amumal.backend.modules.auth.infrastructure.persistence.IdentityStore;
import com.amumal.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final TransactionalWriteCoordinator coordinator;
    private final IdentityStore identityStore;
    private final PasswordVerifier passwordVerifier;
    private final TokenIssuer tokenIssuer;

    public AuthService(
            TransactionalWriteCoordinator coordinator,
            IdentityStore identityStore,
            PasswordVerifier passwordVerifier,
            TokenIssuer tokenIssuer
    ) {
        this.coordinator = coordinator;
        this.identityStore = identityStore;
        this.passwordVerifier = passwordVerifier;
        this.tokenIssuer = tokenIssuer;
    }

    public AuthenticatedSession login(String email, String password) {
        String normalizedEmail = normalizeEmail(email);
        Optional<UserAccount> account = coordinator.read(scope -> identityStore.findActiveByEmail(scope, normalizedEmail));

        // BCrypt 비교는 트랜잭션 밖에서 수행해 커넥션을 오래 잡지 않는다.
        boolean matches = passwordVerifier.verify(password, account.map(UserAccount::getPasswordHash).orElse(null));
        if (!matches) {
            log.info("Login failed (user={})", account.map(UserAccount::getId).orElse(null));
            throw invalidCredentials();
        }

        long userId = account.get().getId();
        IssuedCredentials credentials = coordinator.runAtomic(scope -> {
            if (identityStore.findActiveById(scope, userId).isEmpty()) {
                throw invalidCredentials();
            }
            return tokenIssuer.issue(scope, userId);
        });
        log.info("User {} logged in", userId);
        return new AuthenticatedSession(credentials, UserProfileResponse.from(account.get()));
    }

    public IssuedCredentials refresh(String renewalSecret) {
        return tokenIssuer.rotate(renewalSecret);
    }

    public void logout(String renewalSecret, String accessGrant) {
        coordinator.runAtomicVoid(scope -> tokenIssuer.revoke(scope, renewalSecret, accessGrant));
    }

    public UserProfileResponse loadCurrentUser(long userId) {
        return coordinator.read(scope -> identityStore.findActiveById(scope, userId))
                .map(UserProfileResponse::from)
                .orElseThrow(ProblemException::unauthenticated);
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(ErrorCategory.UNAUTHENTICATED, "INVALID_CREDENTIALS",
                "이메일 또는 비밀번호가 올바르지 않습니다.");
    }
}
