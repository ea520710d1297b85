package com.amumal.backend.modules.auth.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * 비밀번호 검증기. 계정이 없을 때도 기동 시 만든 더미 해시와 비교해
 * "없는 계정"과 "틀린 비밀번호" 경로의 소요 시간을 같게 만든다.
 */
@Component
public class PasswordVerifier {

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public PasswordVerifier(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode(CredentialSecrets.generate(24));
    }

    public boolean verify(String plaintext, String storedHash) {
        String candidate = plaintext != null ? plaintext : "";
        if (storedHash == null) {
            passwordEncoder.matches(candidate, dummyHash);
            return false;
        }
        return passwordEncoder.matches(candidate, storedHash);
    }

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }
}
