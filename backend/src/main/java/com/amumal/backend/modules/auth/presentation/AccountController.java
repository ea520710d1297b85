package com.amumal.backend.modules.auth.presentation;

import java.net.URI;

import com.amumal.backend.global.security.SecurityUtils;
import com.amumal.backend.modules.auth.application.AccountService;
import com.amumal.backend.modules.auth.application.IssuedCredentials;
import com.amumal.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.amumal.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.amumal.backend.modules.auth.presentation.dto.PublicProfileResponse;
import com.amumal.backend.modules.auth.presentation.dto.RegisterRequest;
import com.amumal.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.amumal.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.amumal.backend.modules.auth.presentation.dto.WithdrawRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users")
public class AccountController {

    private final AccountService accountService;
    private final AuthCookies authCookies;

    public AccountController(AccountService accountService, AuthCookies authCookies) {
        this.accountService = accountService;
        this.authCookies = authCookies;
    }

    @Operation(summary = "회원가입")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "가입 성공"),
            @ApiResponse(responseCode = "409", description = "이메일 또는 닉네임 중복")
    })
    @PostMapping
    public ResponseEntity<UserProfileResponse> register(@Valid @RequestBody RegisterRequest request) {
        UserProfileResponse created = accountService.register(request);
        return ResponseEntity.created(URI.create("/v1/users/" + created.id())).body(created);
    }

    @GetMapping("/{userId}")
    public ResponseEntity<PublicProfileResponse> getProfile(@PathVariable long userId) {
        return ResponseEntity.ok(accountService.getPublicProfile(userId));
    }

    @Operation(summary = "프로필 수정", description = "요청에 포함된 필드만 변경한다.")
    @PatchMapping("/me")
    public ResponseEntity<UserProfileResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(accountService.updateProfile(SecurityUtils.getCurrentUserId(), request));
    }

    @Operation(summary = "비밀번호 변경",
            description = "모든 기기의 갱신 토큰을 폐기하고, 요청한 기기에는 새 access token과 갱신 토큰을 발급한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "400", description = "현재 비밀번호 불일치 또는 정책 위반"),
            @ApiResponse(responseCode = "409", description = "다른 요청에서 먼저 변경됨")
    })
    @PutMapping("/me/password")
    public ResponseEntity<AccessTokenResponse> changePassword(
            @Valid @RequestBody ChangePasswordRequest request,
            HttpServletResponse response
    ) {
        IssuedCredentials credentials = accountService.changePassword(SecurityUtils.getCurrentUserId(), request);
        authCookies.writeIssued(response, credentials);
        return ResponseEntity.ok(AccessTokenResponse.from(credentials.accessGrant()));
    }

    @Operation(summary = "회원 탈퇴", description = "계정을 익명화하고 모든 자격증명을 폐기한다. 작성한 글은 유지된다.")
    @DeleteMapping("/me")
    public ResponseEntity<Void> withdraw(@Valid @RequestBody WithdrawRequest request, HttpServletResponse response) {
        accountService.withdraw(SecurityUtils.getCurrentUserId(), request.password());
        authCookies.clearRefresh(response);
        return ResponseEntity.noContent().build();
    }
}
