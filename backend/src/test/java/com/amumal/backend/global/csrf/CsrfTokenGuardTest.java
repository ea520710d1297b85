package com.amumal.backend.global.csrf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;

import org.junit.jupiter.api.Test;

class CsrfTokenGuardTest {

    private final CsrfTokenGuard guard = new CsrfTokenGuard();

    @Test
    void matchingPairPasses() {
        assertThatCode(() -> guard.check("abc123", "abc123", "POST")).doesNotThrowAnyException();
        assertThatCode(() -> guard.check("abc123", "abc123", "delete")).doesNotThrowAnyException();
    }

    @Test
    void missingHeaderIsRejected() {
        assertThatThrownBy(() -> guard.check("abc123", null, "PATCH"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCategory()).isEqualTo(ErrorCategory.INTEGRITY_MISMATCH);
                    assertThat(ex.getCode()).isEqualTo(CsrfTokenGuard.MISSING_CODE);
                });
    }

    @Test
    void missingCookieIsRejected() {
        assertThatThrownBy(() -> guard.check("", "abc123", "PUT"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(CsrfTokenGuard.MISSING_CODE));
    }

    @Test
    void mismatchIsRejectedRegardlessOfLength() {
        assertThatThrownBy(() -> guard.check("abc123", "abc124", "POST"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(CsrfTokenGuard.MISMATCH_CODE));
        assertThatThrownBy(() -> guard.check("abc123", "abc123-and-more", "POST"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(CsrfTokenGuard.MISMATCH_CODE));
    }

    @Test
    void safeMethodsAreNotChecked() {
        assertThatCode(() -> guard.check(null, null, "GET")).doesNotThrowAnyException();
        assertThatCode(() -> guard.check(null, null, "HEAD")).doesNotThrowAnyException();
        assertThatCode(() -> guard.check(null, null, "OPTIONS")).doesNotThrowAnyException();
    }

    @Test
    void mintedTokensAreUnguessableAndDistinct() {
        String first = guard.mintToken();
        String second = guard.mintToken();

        assertThat(first).hasSize(43).doesNotContain("=");
        assertThat(first).isNotEqualTo(second);
    }
}
