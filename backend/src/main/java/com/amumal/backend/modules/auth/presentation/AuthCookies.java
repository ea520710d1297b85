package com.amumal.backend.modules.auth.presentation;

import java.time.Duration;

import com.amumal.backend.global.config.AuthProperties;
import com.amumal.backend.global.csrf.CsrfCookieIssuer;
import com.amumal.backend.modules.auth.application.IssuedCredentials;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * 갱신 비밀값 쿠키(HttpOnly, Path=/v1/auth)를 내려주고, 발급할 때마다 CSRF 토큰도 새로 발급한다.
 */
@Component
public class AuthCookies {

    public static final String REFRESH_COOKIE_NAME = "refresh_token";
    static final String REFRESH_COOKIE_PATH = "/v1/auth";

    private final AuthProperties authProperties;
    private final CsrfCookieIssuer csrfCookieIssuer;

    public AuthCookies(AuthProperties authProperties, CsrfCookieIssuer csrfCookieIssuer) {
        this.authProperties = authProperties;
        this.csrfCookieIssuer = csrfCookieIssuer;
    }

    public void writeIssued(HttpServletResponse response, IssuedCredentials credentials) {
        response.addHeader(HttpHeaders.SET_COOKIE,
                refreshCookie(credentials.renewalSecret(), authProperties.refreshTtl()).toString());
        csrfCookieIssuer.issue(response);
    }

    public void clearRefresh(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, refreshCookie("", Duration.ZERO).toString());
    }

    private ResponseCookie refreshCookie(String value, Duration maxAge) {
        return ResponseCookie.from(REFRESH_COOKIE_NAME, value)
                .httpOnly(true)
                .secure(authProperties.cookieSecure())
                .sameSite("Lax")
                .path(REFRESH_COOKIE_PATH)
                .maxAge(maxAge)
                .build();
    }
}
