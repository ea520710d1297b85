package com.amumal.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class PasswordVerifierTest {

    private final BCryptPasswordEncoder encoder = spy(new BCryptPasswordEncoder(4));
    private final PasswordVerifier verifier = new PasswordVerifier(encoder);

    @Test
    void acceptsMatchingPasswordAndRejectsOthers() {
        String hash = verifier.hash("Passw0rd!");

        assertThat(hash).startsWith("$2a$04$").doesNotContain("Passw0rd!");
        assertThat(verifier.verify("Passw0rd!", hash)).isTrue();
        assertThat(verifier.verify("Passw0rd?", hash)).isFalse();
        assertThat(verifier.verify(null, hash)).isFalse();
    }

    @Test
    void hashingIsSalted() {
        assertThat(verifier.hash("Passw0rd!")).isNotEqualTo(verifier.hash("Passw0rd!"));
    }

    @Test
    @DisplayName("계정이 없을 때도 더미 해시로 같은 비용의 비교를 수행한다")
    void missingAccountStillPaysHashingCost() {
        assertThat(verifier.verify("Passw0rd!", null)).isFalse();

        verify(encoder, times(1)).matches(eq("Passw0rd!"), anyString());
    }
}
