package com.amumal.backend.global.csrf;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Set;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Double-submit 방식의 위조 요청 방지 토큰 검사기.
 * 서버는 토큰을 저장하지 않으며 쿠키 값과 헤더 값의 일치 여부만 상수 시간으로 비교한다.
 */
@Component
public class CsrfTokenGuard {

    public static final String COOKIE_NAME = "csrf_token";
    public static final String HEADER_NAME = "X-CSRF-Token";

    static final String MISSING_CODE = "CSRF_TOKEN_MISSING";
    static final String MISMATCH_CODE = "CSRF_TOKEN_MISMATCH";

    private static final Set<String> STATE_CHANGING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    public void check(String cookieToken, String headerToken, String method) {
        if (!requiresCheck(method)) {
            return;
        }
        if (!StringUtils.hasText(cookieToken) || !StringUtils.hasText(headerToken)) {
            throw new ProblemException(ErrorCategory.INTEGRITY_MISMATCH, MISSING_CODE, "CSRF 토큰이 없습니다.");
        }
        // 길이 차이로 인한 조기 종료를 피하기 위해 고정 길이 다이제스트끼리 비교한다.
        if (!MessageDigest.isEqual(digest(cookieToken), digest(headerToken))) {
            throw new ProblemException(ErrorCategory.INTEGRITY_MISMATCH, MISMATCH_CODE, "CSRF 토큰이 일치하지 않습니다.");
        }
    }

    public boolean requiresCheck(String method) {
        return method != null && STATE_CHANGING_METHODS.contains(method.toUpperCase());
    }

    public String mintToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static byte[] digest(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
