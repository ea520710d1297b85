package com.amumal.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.modules.auth.application.IssuedCredentials;
import com.amumal.backend.modules.auth.application.TokenIssuer;
import com.amumal.backend.support.AbstractPostgresIntegrationTest;
import com.amumal.backend.support.TestAccounts;
import com.amumal.backend.support.TestAccounts.LoggedInUser;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class TokenRotationConcurrencyIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TokenIssuer tokenIssuer;

    @RepeatedTest(3)
    @DisplayName("같은 갱신 비밀값으로 동시에 회전하면 정확히 하나만 성공하고 계정의 토큰이 모두 폐기된다")
    void concurrentRotationOfSameSecretHasSingleWinner() throws Exception {
        LoggedInUser user = TestAccounts.registerAndLogin(mockMvc, objectMapper);
        String secret = user.refreshToken();

        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<IssuedCredentials>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                Callable<IssuedCredentials> attempt = () -> {
                    ready.countDown();
                    start.await(5, TimeUnit.SECONDS);
                    return tokenIssuer.rotate(secret);
                };
                futures.add(executor.submit(attempt));
            }
            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            start.countDown();

            List<IssuedCredentials> winners = new ArrayList<>();
            int rejected = 0;
            for (Future<IssuedCredentials> future : futures) {
                try {
                    winners.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOf(ProblemException.class);
                    rejected++;
                }
            }

            assertThat(winners).hasSize(1);
            assertThat(rejected).isEqualTo(1);
            // 패자가 재사용을 감지해 승자가 받은 새 비밀값까지 폐기한다.
            String winnerSecret = winners.get(0).renewalSecret();
            assertThatThrownBy(() -> tokenIssuer.rotate(winnerSecret)).isInstanceOf(ProblemException.class);
            assertThatThrownBy(() -> tokenIssuer.rotate(secret)).isInstanceOf(ProblemException.class);
        } finally {
            executor.shutdownNow();
        }
    }
}
