package com.amumal.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.amumal.backend.global.config.AuthProperties;

import org.springframework.stereotype.Component;

/**
 * JWT 서명용 시크릿 키 래퍼. HS256에 필요한 최소 길이(32바이트)를 강제한다.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(AuthProperties authProperties) {
        this.secretKey = new SecretKeySpec(decode(authProperties.jwtSecret()), HMAC_SHA_256);
    }

    static byte[] decode(String secretString) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            // base64로 해석 가능한 짧은 문자열은 원문 바이트를 사용한다.
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_KEY_BYTES + " bytes");
        }
        return keyBytes;
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
