package com.amumal.backend.modules.auth.application;

import java.util.EnumMap;
import java.util.Map;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.global.transaction.TransactionalWriteCoordinator;
import com.amumal.backend.modules.auth.domain.UserAccount;
import com.amumal.backend.modules.auth.domain.UserAccountColumn;
import com.amumal.backend.modules.auth.infrastructure.persistence.IdentityStore;
import com.amumal.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.amumal.backend.modules.auth.presentation.dto.PublicProfileResponse;
import com.amumal.backend.modules.auth.presentation.dto.RegisterRequest;
import com.amumal.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.amumal.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 회원가입, 프로필 수정, 비밀번호 변경, 탈퇴.
 * 계정 상태를 바꾸는 작업은 모두 {@link TransactionalWriteCoordinator}의 원자 단위로 실행한다.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final String EMAIL_ALREADY_EXISTS = "email_already_exists";
    static final String NICKNAME_ALREADY_EXISTS = "nickname_already_exists";
    static final String NO_CHANGES_PROVIDED = "no_changes_provided";
    static final String PASSWORD_MISMATCH = "password_mismatch";
    static final String SAME_PASSWORD = "same_password";
    static final String WRONG_PASSWORD = "WRONG_PASSWORD";
    static final String PASSWORD_CHANGED_CONCURRENTLY = "password_changed_concurrently";

    private final TransactionalWriteCoordinator coordinator;
    private final IdentityStore identityStore;
    private final PasswordVerifier passwordVerifier;
    private final PasswordPolicy passwordPolicy;
    private final TokenIssuer tokenIssuer;
    private final AccountWithdrawalProcedure withdrawalProcedure;

    public AccountService(
            TransactionalWriteCoordinator coordinator,
            IdentityStore identityStore,
            PasswordVerifier passwordVerifier,
            PasswordPolicy passwordPolicy,
            TokenIssuer tokenIssuer,
            AccountWithdrawalProcedure withdrawalProcedure
    ) {
        this.coordinator = coordinator;
        this.identityStore = identityStore;
        this.passwordVerifier = passwordVerifier;
        this.passwordPolicy = passwordPolicy;
        this.tokenIssuer = tokenIssuer;
        this.withdrawalProcedure = withdrawalProcedure;
    }

    public UserProfileResponse register(RegisterRequest request) {
        passwordPolicy.validate(request.password());
        String email = AuthService.normalizeEmail(request.email());
        String nickname = request.nickname().trim();
        String passwordHash = passwordVerifier.hash(request.password());
        String profileImageUrl = blankToNull(request.profileImageUrl());

        UserProfileResponse created = coordinator.runAtomic(scope -> {
            if (identityStore.isEmailTaken(scope, email, null)) {
                throw conflict(EMAIL_ALREADY_EXISTS, "이미 사용 중인 이메일입니다.");
            }
            if (identityStore.isNicknameTaken(scope, nickname, null)) {
                throw conflict(NICKNAME_ALREADY_EXISTS, "이미 사용 중인 닉네임입니다.");
            }
            UserAccount saved = identityStore.insert(scope, new UserAccount(email, nickname, passwordHash, profileImageUrl));
            return UserProfileResponse.from(saved);
        });
        log.info("User {} registered", created.id());
        return created;
    }

    public PublicProfileResponse getPublicProfile(long userId) {
        return coordinator.read(scope -> identityStore.findActiveById(scope, userId))
                .map(PublicProfileResponse::from)
                .orElseThrow(() -> new ProblemException(ErrorCategory.NOT_FOUND, "user_not_found", "사용자를 찾을 수 없습니다."));
    }

    /**
     * 요청에 포함된 필드만 갱신한다. profileImageUrl에 빈 문자열을 보내면 이미지를 제거한다.
     */
    public UserProfileResponse updateProfile(long userId, UpdateProfileRequest request) {
        Map<UserAccountColumn, String> changes = new EnumMap<>(UserAccountColumn.class);
        if (request.email() != null) {
            changes.put(UserAccountColumn.EMAIL, AuthService.normalizeEmail(request.email()));
        }
        if (request.nickname() != null) {
            changes.put(UserAccountColumn.NICKNAME, request.nickname().trim());
        }
        if (request.profileImageUrl() != null) {
            changes.put(UserAccountColumn.PROFILE_IMAGE_URL, blankToNull(request.profileImageUrl()));
        }
        if (changes.isEmpty()) {
            throw new ProblemException(ErrorCategory.VALIDATION, NO_CHANGES_PROVIDED, "변경할 항목이 없습니다.");
        }

        return coordinator.runAtomic(scope -> {
            String email = changes.get(UserAccountColumn.EMAIL);
            if (email != null && identityStore.isEmailTaken(scope, email, userId)) {
                throw conflict(EMAIL_ALREADY_EXISTS, "이미 사용 중인 이메일입니다.");
            }
            String nickname = changes.get(UserAccountColumn.NICKNAME);
            if (nickname != null && identityStore.isNicknameTaken(scope, nickname, userId)) {
                throw conflict(NICKNAME_ALREADY_EXISTS, "이미 사용 중인 닉네임입니다.");
            }
            return identityStore.updateFields(scope, userId, changes)
                    .map(UserProfileResponse::from)
                    .orElseThrow(ProblemException::unauthenticated);
        });
    }

    /**
     * 비밀번호를 바꾸고 계정의 모든 갱신 비밀값과 서버 세션을 폐기한 뒤, 요청한 기기에 새 자격증명을 발급한다.
     * 확인한 해시가 그대로일 때만 갱신하므로 같은 현재 비밀번호로 동시에 들어온 변경은 하나만 성공한다.
     */
    public IssuedCredentials changePassword(long userId, ChangePasswordRequest request) {
        if (!request.newPassword().equals(request.newPasswordConfirm())) {
            throw new ProblemException(ErrorCategory.VALIDATION, PASSWORD_MISMATCH, "새 비밀번호가 일치하지 않습니다.");
        }
        passwordPolicy.validate(request.newPassword());

        UserAccount account = loadActive(userId);
        String verifiedHash = account.getPasswordHash();
        if (!passwordVerifier.verify(request.currentPassword(), verifiedHash)) {
            throw wrongPassword();
        }
        if (passwordVerifier.verify(request.newPassword(), verifiedHash)) {
            throw new ProblemException(ErrorCategory.VALIDATION, SAME_PASSWORD, "현재 비밀번호와 다른 비밀번호를 입력해 주세요.");
        }
        String newHash = passwordVerifier.hash(request.newPassword());

        IssuedCredentials issued = coordinator.runAtomic(scope -> {
            if (identityStore.updateFieldsIfPasswordHash(scope, userId, verifiedHash,
                    Map.of(UserAccountColumn.PASSWORD_HASH, newHash)).isEmpty()) {
                if (identityStore.findActiveById(scope, userId).isEmpty()) {
                    throw ProblemException.unauthenticated();
                }
                throw conflict(PASSWORD_CHANGED_CONCURRENTLY, "비밀번호가 다른 요청에서 먼저 변경되었습니다.");
            }
            tokenIssuer.revokeAll(scope, userId);
            return tokenIssuer.issue(scope, userId);
        });
        log.info("User {} changed password", userId);
        return issued;
    }

    public void withdraw(long userId, String confirmedPassword) {
        UserAccount account = loadActive(userId);
        if (!passwordVerifier.verify(confirmedPassword, account.getPasswordHash())) {
            throw wrongPassword();
        }
        boolean withdrawn = coordinator.runAtomic(scope -> withdrawalProcedure.execute(scope, userId));
        if (!withdrawn) {
            throw ProblemException.unauthenticated();
        }
    }

    /**
     * 관리 작업용 강제 탈퇴. 비밀번호 확인 없이 같은 탈퇴 절차를 실행한다.
     */
    public void forceWithdraw(long userId) {
        boolean withdrawn = coordinator.runAtomic(scope -> withdrawalProcedure.execute(scope, userId));
        if (!withdrawn) {
            throw new ProblemException(ErrorCategory.NOT_FOUND, "user_not_found", "사용자를 찾을 수 없습니다.");
        }
        log.info("User {} force-withdrawn", userId);
    }

    private UserAccount loadActive(long userId) {
        return coordinator.read(scope -> identityStore.findActiveById(scope, userId))
                .orElseThrow(ProblemException::unauthenticated);
    }

    private static ProblemException conflict(String code, String detail) {
        return new ProblemException(ErrorCategory.CONFLICT, code, detail);
    }

    private static ProblemException wrongPassword() {
        return new ProblemException(ErrorCategory.VALIDATION, WRONG_PASSWORD, "비밀번호가 올바르지 않습니다.");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
