package com.amumal.backend.modules.auth.application;

import com.amumal.backend.global.transaction.TransactionScope;

/**
 * access grant 발급과 폐기. 서버 세션 방식은 호출한 원자 단위 안에서 세션 행을 기록/삭제한다.
 */
public interface AccessGrantMinter {

    AccessGrant mint(TransactionScope scope, long userId);

    void revoke(TransactionScope scope, String accessGrant);

    void revokeAll(TransactionScope scope, long userId);
}
