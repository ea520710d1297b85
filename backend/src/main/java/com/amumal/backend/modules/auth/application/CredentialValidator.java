package com.amumal.backend.modules.auth.application;

/**
 * access grant 검증 방식. app.auth.access-mode 설정에 따라 JWT(무상태) 또는 서버 세션 구현 중 하나가 선택된다.
 */
public interface CredentialValidator {

    /**
     * @return access grant 소유자의 계정 id
     * @throws CredentialRejectedException 만료, 형식 오류, 미등록 grant인 경우
     */
    long validate(String accessGrant);
}
