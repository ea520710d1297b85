package com.amumal.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 보안 설정 검증.
 * 검증 실패 시 예외로 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEVELOPMENT_JWT_SECRET = "dev-only-jwt-secret-change-me-before-deploying-amumal";
    private static final int MIN_SECRET_BYTES = 32;

    private final Environment environment;
    private final AuthProperties authProperties;

    public EnvironmentValidator(Environment environment, AuthProperties authProperties) {
        this.environment = environment;
        this.authProperties = authProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = findProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("환경설정 검증 실패: {}", problem));
            throw new IllegalStateException("환경설정 검증 실패: " + String.join("; ", problems));
        }
        log.info("환경설정 검증 완료 (access-mode={})", authProperties.accessMode());
    }

    List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        String secret = authProperties.jwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add("app.auth.jwt-secret: 최소 " + MIN_SECRET_BYTES + "바이트 이상이어야 합니다");
        }
        boolean developmentProfile = environment.acceptsProfiles(Profiles.of("dev", "test"));
        if (!developmentProfile && DEVELOPMENT_JWT_SECRET.equals(secret)) {
            problems.add("app.auth.jwt-secret: 기본값을 실제 랜덤 문자열로 변경하세요");
        }
        if (authProperties.refreshTtl().compareTo(authProperties.accessTtl()) <= 0) {
            problems.add("app.auth.refresh-ttl: access-ttl보다 길어야 합니다");
        }
        if (authProperties.password().minLength() > authProperties.password().maxLength()) {
            problems.add("app.auth.password: min-length가 max-length보다 클 수 없습니다");
        }
        return problems;
    }
}
