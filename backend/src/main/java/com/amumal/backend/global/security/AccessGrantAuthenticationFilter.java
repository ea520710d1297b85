package com.amumal.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.amumal.backend.modules.auth.application.CredentialRejectedException;
import com.amumal.backend.modules.auth.application.CredentialValidator;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Bearer access grant를 검증해 SecurityContext에 사용자 식별자를 채운다.
 * 검증 방식(JWT 또는 서버 세션)은 {@link CredentialValidator} 구현에 위임한다.
 */
@Component
public class AccessGrantAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessGrantAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<SimpleGrantedAuthority> USER_AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final CredentialValidator credentialValidator;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public AccessGrantAuthenticationFilter(
            CredentialValidator credentialValidator,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.credentialValidator = credentialValidator;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String grant = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                long userId = credentialValidator.validate(grant);
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(new AuthenticatedUser(userId), null, USER_AUTHORITIES);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (CredentialRejectedException ex) {
                SecurityContextHolder.clearContext();
                log.debug("Access grant rejected: {}", ex.getReason());
                authenticationEntryPoint.commence(request, response,
                        new BadCredentialsException("INVALID_ACCESS_TOKEN", ex));
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return request.getMethod().equalsIgnoreCase("OPTIONS");
    }
}
