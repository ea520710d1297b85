package com.amumal.backend.modules.auth.application;

import com.amumal.backend.global.config.AuthProperties;
import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;

import org.springframework.stereotype.Component;

/**
 * 비밀번호 정책: 길이 범위, 필수 문자 종류, 허용 문자(영문, 숫자, 지정 특수문자).
 */
@Component
public class PasswordPolicy {

    static final String INVALID_PASSWORD = "invalid_password";

    private final AuthProperties.Password rules;

    public PasswordPolicy(AuthProperties authProperties) {
        this.rules = authProperties.password();
    }

    public void validate(String password) {
        if (password == null
                || password.length() < rules.minLength()
                || password.length() > rules.maxLength()) {
            throw violation();
        }
        boolean hasUpper = false;
        boolean hasLower = false;
        boolean hasDigit = false;
        boolean hasSpecial = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                hasUpper = true;
            } else if (c >= 'a' && c <= 'z') {
                hasLower = true;
            } else if (c >= '0' && c <= '9') {
                hasDigit = true;
            } else if (rules.specialCharacters().indexOf(c) >= 0) {
                hasSpecial = true;
            } else {
                throw violation();
            }
        }
        if ((rules.requireUppercase() && !hasUpper)
                || (rules.requireLowercase() && !hasLower)
                || (rules.requireDigit() && !hasDigit)
                || !hasSpecial) {
            throw violation();
        }
    }

    private ProblemException violation() {
        String detail = String.format("비밀번호는 %d~%d자이며 영문 대/소문자, 숫자, 특수문자(%s)를 포함해야 합니다.",
                rules.minLength(), rules.maxLength(), rules.specialCharacters());
        return new ProblemException(ErrorCategory.VALIDATION, INVALID_PASSWORD, detail);
    }
}
