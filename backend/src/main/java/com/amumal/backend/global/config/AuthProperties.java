package com.amumal.backend.global.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 인증 정책 설정.
 *
 * app:
 *   auth:
 *     jwt-secret: ${JWT_SECRET}
 *     access-ttl: 30m
 *     refresh-ttl: 7d
 *     access-mode: stateless   # stateless | session
 *     cookie-secure: true
 *     csrf-cookie-ttl: 24h
 *     password:
 *       bcrypt-strength: 12
 *       min-length: 8
 *       max-length: 20
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @NotBlank String jwtSecret,
        @NotNull Duration accessTtl,
        @NotNull Duration refreshTtl,
        @NotNull AccessMode accessMode,
        boolean cookieSecure,
        @NotNull Duration csrfCookieTtl,
        @Valid @NotNull Password password
) {

    public enum AccessMode {
        STATELESS,
        SESSION
    }

    public record Password(
            @Min(4) @Max(31) int bcryptStrength,
            @Min(1) int minLength,
            @Min(1) int maxLength,
            boolean requireUppercase,
            boolean requireLowercase,
            boolean requireDigit,
            @NotBlank String specialCharacters
    ) {
    }
}
