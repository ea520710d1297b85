package com.amumal.backend.modules.auth.application;

import com.amumal.backend.global.transaction.TransactionScope;
import com.amumal.backend.modules.auth.infrastructure.persistence.CredentialStore;
import com.amumal.backend.modules.auth.infrastructure.persistence.IdentityStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 탈퇴 처리: 소프트 삭제와 익명화, 자격증명 전부 삭제를 하나의 원자 단위 안에서 수행한다.
 * 이메일과 닉네임은 자리표시자로 바뀌므로 원래 값으로 재가입할 수 있다.
 * 게시글/댓글의 author_id는 그대로 유지된다.
 */
@Component
public class AccountWithdrawalProcedure {

    private static final Logger log = LoggerFactory.getLogger(AccountWithdrawalProcedure.class);

    static final String WITHDRAWN_PASSWORD_MARKER = "{withdrawn}";
    private static final int SUFFIX_BYTES = 4;

    private final IdentityStore identityStore;
    private final CredentialStore credentialStore;

    public AccountWithdrawalProcedure(IdentityStore identityStore, CredentialStore credentialStore) {
        this.identityStore = identityStore;
        this.credentialStore = credentialStore;
    }

    /**
     * @return 활성 계정이 탈퇴 처리되었으면 true, 이미 탈퇴했거나 없는 계정이면 false
     */
    public boolean execute(TransactionScope scope, long userId) {
        String suffix = CredentialSecrets.randomHex(SUFFIX_BYTES);
        String anonymizedEmail = "withdrawn-" + userId + "-" + suffix + "@deleted.invalid";
        String anonymizedNickname = "deleted_" + userId + "_" + suffix;

        if (!identityStore.markWithdrawn(scope, userId, anonymizedEmail, anonymizedNickname, WITHDRAWN_PASSWORD_MARKER)) {
            return false;
        }
        int refreshTokens = credentialStore.deleteRefreshTokensOf(scope, userId);
        int tombstones = credentialStore.deleteTombstonesOf(scope, userId);
        int sessions = credentialStore.deleteSessionsOf(scope, userId);
        log.info("Account {} withdrawn (refreshTokens={}, tombstones={}, sessions={})",
                userId, refreshTokens, tombstones, sessions);
        return true;
    }
}
