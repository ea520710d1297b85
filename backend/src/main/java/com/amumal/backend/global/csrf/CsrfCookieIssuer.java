package com.amumal.backend.global.csrf;

import com.amumal.backend.global.config.AuthProperties;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * 새 CSRF 토큰을 발급해 쿠키로 내려준다. 스크립트가 헤더로 옮겨 담아야 하므로 HttpOnly가 아니다.
 */
@Component
public class CsrfCookieIssuer {

    private final CsrfTokenGuard csrfTokenGuard;
    private final AuthProperties authProperties;

    public CsrfCookieIssuer(CsrfTokenGuard csrfTokenGuard, AuthProperties authProperties) {
        this.csrfTokenGuard = csrfTokenGuard;
        this.authProperties = authProperties;
    }

    public String issue(HttpServletResponse response) {
        String token = csrfTokenGuard.mintToken();
        ResponseCookie cookie = ResponseCookie.from(CsrfTokenGuard.COOKIE_NAME, token)
                .httpOnly(false)
                .secure(authProperties.cookieSecure())
                .sameSite("Strict")
                .path("/")
                .maxAge(authProperties.csrfCookieTtl())
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        return token;
    }
}
