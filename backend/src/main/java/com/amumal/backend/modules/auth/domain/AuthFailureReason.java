package com.amumal.backend.modules.auth.domain;

/**
 * 자격증명 거부 사유. 로그에만 기록되며 클라이언트에는 항상 UNAUTHENTICATED로 응답한다.
 */
public enum AuthFailureReason {
    NOT_FOUND,
    EXPIRED,
    REUSED,
    MALFORMED,
    INACTIVE_ACCOUNT
}
