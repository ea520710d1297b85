package com.amumal.backend.modules.auth.presentation;

import com.amumal.backend.global.security.SecurityUtils;
import com.amumal.backend.modules.auth.application.AuthService;
import com.amumal.backend.modules.auth.application.AuthenticatedSession;
import com.amumal.backend.modules.auth.application.IssuedCredentials;
import com.amumal.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.amumal.backend.modules.auth.presentation.dto.LoginRequest;
import com.amumal.backend.modules.auth.presentation.dto.LoginResponse;
import com.amumal.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/auth")
public class AuthController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;
    private final AuthCookies authCookies;

    public AuthController(AuthService authService, AuthCookies authCookies) {
        this.authService = authService;
        this.authCookies = authCookies;
    }

    @Operation(summary = "로그인", description = "access token을 본문으로, 갱신 토큰을 HttpOnly 쿠키로 발급한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "로그인 성공"),
            @ApiResponse(responseCode = "401", description = "이메일 또는 비밀번호 불일치"),
            @ApiResponse(responseCode = "429", description = "요청 제한 초과")
    })
    @PostMapping("/session")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletResponse response) {
        AuthenticatedSession session = authService.login(request.email(), request.password());
        authCookies.writeIssued(response, session.credentials());
        return ResponseEntity.ok(new LoginResponse(
                AccessTokenResponse.from(session.credentials().accessGrant()),
                session.user()
        ));
    }

    @Operation(summary = "로그아웃", description = "현재 갱신 토큰을 폐기한다. 이미 폐기된 토큰이어도 성공으로 응답한다.")
    @DeleteMapping("/session")
    public ResponseEntity<Void> logout(
            @CookieValue(name = AuthCookies.REFRESH_COOKIE_NAME, required = false) String renewalSecret,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletResponse response
    ) {
        authService.logout(renewalSecret, extractBearer(authorization));
        authCookies.clearRefresh(response);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "토큰 갱신", description = "갱신 토큰을 회전하고 새 access token을 발급한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "갱신 성공"),
            @ApiResponse(responseCode = "401", description = "유효하지 않거나 재사용된 갱신 토큰")
    })
    @PostMapping("/token/refresh")
    public ResponseEntity<AccessTokenResponse> refresh(
            @CookieValue(name = AuthCookies.REFRESH_COOKIE_NAME, required = false) String renewalSecret,
            HttpServletResponse response
    ) {
        IssuedCredentials credentials = authService.refresh(renewalSecret);
        authCookies.writeIssued(response, credentials);
        return ResponseEntity.ok(AccessTokenResponse.from(credentials.accessGrant()));
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(authService.loadCurrentUser(SecurityUtils.getCurrentUserId()));
    }

    private static String extractBearer(String authorization) {
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
