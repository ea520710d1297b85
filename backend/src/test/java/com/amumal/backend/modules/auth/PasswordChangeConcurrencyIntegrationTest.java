package com.amumal.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;

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
import com.amumal.backend.modules.auth.application.AccountService;
import com.amumal.backend.modules.auth.application.IssuedCredentials;
import com.amumal.backend.modules.auth.domain.UserAccount;
import com.amumal.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.amumal.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.amumal.backend.support.AbstractPostgresIntegrationTest;
import com.amumal.backend.support.TestAccounts;
import com.amumal.backend.support.TestAccounts.LoggedInUser;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class PasswordChangeConcurrencyIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final List<String> NEW_PASSWORDS = List.of("Fir5tPass!", "Sec0ndPass!");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountService accountService;

    @Autowired
    private UserAccountRepository userAccountRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @RepeatedTest(3)
    @DisplayName("같은 현재 비밀번호로 동시에 변경하면 하나만 성공하고 저장된 해시는 승자의 비밀번호다")
    void concurrentChangesWithSameCurrentPasswordHaveSingleWinner() throws Exception {
        LoggedInUser user = TestAccounts.registerAndLogin(mockMvc, objectMapper);

        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<IssuedCredentials>> futures = new ArrayList<>();
        try {
            for (String newPassword : NEW_PASSWORDS) {
                Callable<IssuedCredentials> attempt = () -> {
                    ready.countDown();
                    start.await(5, TimeUnit.SECONDS);
                    return accountService.changePassword(user.userId(),
                            new ChangePasswordRequest(TestAccounts.DEFAULT_PASSWORD, newPassword, newPassword));
                };
                futures.add(executor.submit(attempt));
            }
            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            start.countDown();

            List<String> winners = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get(30, TimeUnit.SECONDS);
                    winners.add(NEW_PASSWORDS.get(i));
                } catch (ExecutionException ex) {
                    // 늦게 읽은 쪽은 WRONG_PASSWORD, 같은 해시를 읽은 쪽은 충돌로 거부된다.
                    assertThat(ex.getCause()).isInstanceOf(ProblemException.class);
                    assertThat(((ProblemException) ex.getCause()).getCode())
                            .isIn("password_changed_concurrently", "WRONG_PASSWORD");
                }
            }

            assertThat(winners).hasSize(1);
            UserAccount stored = userAccountRepository.findById(user.userId()).orElseThrow();
            assertThat(passwordEncoder.matches(winners.get(0), stored.getPasswordHash())).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
