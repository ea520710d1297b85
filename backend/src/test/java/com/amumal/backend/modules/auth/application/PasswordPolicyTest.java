package com.amumal.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import com.amumal.backend.global.config.AuthProperties;
import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PasswordPolicyTest {

    static final AuthProperties AUTH_PROPERTIES = new AuthProperties(
            "unit-test-secret-that-is-long-enough-0123456789",
            Duration.ofMinutes(30),
            Duration.ofDays(7),
            AuthProperties.AccessMode.STATELESS,
            false,
            Duration.ofHours(24),
            new AuthProperties.Password(4, 8, 20, true, true, true, "@$!%*?&")
    );

    private final PasswordPolicy policy = new PasswordPolicy(AUTH_PROPERTIES);

    @ParameterizedTest
    @ValueSource(strings = {"Passw0rd!", "Abcdef1@", "Zz9$Zz9$Zz9$Zz9$Zz9$"})
    void acceptsCompliantPasswords(String password) {
        assertThatCode(() -> policy.validate(password)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Pw0rd!",                 // 너무 짧음
            "Passw0rd!Passw0rd!Pass", // 너무 김
            "passw0rd!",              // 대문자 없음
            "PASSW0RD!",              // 소문자 없음
            "Password!",              // 숫자 없음
            "Passw0rdd",              // 특수문자 없음
            "Passw0rd#",              // 허용되지 않은 특수문자
            "Passw0rd! "              // 공백
    })
    void rejectsNonCompliantPasswords(String password) {
        assertThatThrownBy(() -> policy.validate(password))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCategory()).isEqualTo(ErrorCategory.VALIDATION);
                    assertThat(ex.getCode()).isEqualTo(PasswordPolicy.INVALID_PASSWORD);
                });
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> policy.validate(null)).isInstanceOf(ProblemException.class);
    }
}
