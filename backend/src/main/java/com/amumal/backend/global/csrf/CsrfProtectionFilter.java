package com.amumal.backend.global.csrf;

import java.io.IOException;
import java.util.Set;

import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.global.error.ProblemResponseWriter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;
import org.springframework.web.util.WebUtils;

/**
 * 상태 변경 요청의 CSRF 토큰 쌍을 검사하고, 토큰 쿠키가 없는 안전한 요청에는 새 쿠키를 발급한다.
 * 로그인과 회원가입은 (메서드, 경로) 정확히 일치하는 경우에만 검사에서 제외한다.
 */
@Component
public class CsrfProtectionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CsrfProtectionFilter.class);

    private static final Set<String> EXEMPT_REQUESTS = Set.of(
            "POST /v1/auth/session",
            "POST /v1/users"
    );

    private final CsrfTokenGuard csrfTokenGuard;
    private final CsrfCookieIssuer csrfCookieIssuer;
    private final ProblemResponseWriter problemResponseWriter;

    public CsrfProtectionFilter(
            CsrfTokenGuard csrfTokenGuard,
            CsrfCookieIssuer csrfCookieIssuer,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.csrfTokenGuard = csrfTokenGuard;
        this.csrfCookieIssuer = csrfCookieIssuer;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Cookie cookie = WebUtils.getCookie(request, CsrfTokenGuard.COOKIE_NAME);
        String cookieToken = cookie != null ? cookie.getValue() : null;

        if (!csrfTokenGuard.requiresCheck(request.getMethod())) {
            if (cookieToken == null) {
                csrfCookieIssuer.issue(response);
            }
            filterChain.doFilter(request, response);
            return;
        }

        try {
            csrfTokenGuard.check(cookieToken, request.getHeader(CsrfTokenGuard.HEADER_NAME), request.getMethod());
        } catch (ProblemException ex) {
            log.warn("CSRF check failed ({}) on {} {}", ex.getCode(), request.getMethod(), request.getRequestURI());
            problemResponseWriter.write(request, response, ex);
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        if (path.equals("/health") || path.startsWith("/actuator/health")) {
            return true;
        }
        return EXEMPT_REQUESTS.contains(request.getMethod().toUpperCase() + " " + path);
    }
}
