package com.amumal.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * 클라이언트에 노출되는 실패 분류. 세부 원인(만료, 재사용 등)은 로그에만 남긴다.
 */
public enum ErrorCategory {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    CONFLICT(HttpStatus.CONFLICT),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    INTEGRITY_MISMATCH(HttpStatus.FORBIDDEN),
    VALIDATION(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    IO_ERROR(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorCategory(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
