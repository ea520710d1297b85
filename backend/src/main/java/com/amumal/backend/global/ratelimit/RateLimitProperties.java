package com.amumal.backend.global.ratelimit;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 요청 제한 설정.
 *
 * app:
 *   rate-limit:
 *     capacity: 10000              # 추적하는 (클라이언트, 등급) 키의 최대 수
 *     unknown-client-max: 10       # 주소를 판별할 수 없는 요청의 상한
 *     trusted-proxies: [127.0.0.1]
 *     classes:
 *       login: { max-requests: 5, window: 60s }
 *     routes:
 *       - { method: POST, path: /v1/auth/session, limiter-class: login }
 */
@Validated
@ConfigurationProperties(prefix = "app.rate-limit")
public record RateLimitProperties(
        @DefaultValue("true") boolean enabled,
        @Min(1) @DefaultValue("10000") int capacity,
        @Min(1) @DefaultValue("10") int unknownClientMax,
        List<String> trustedProxies,
        @NotEmpty Map<String, @Valid LimiterClass> classes,
        List<@Valid Route> routes
) {

    public static final String DEFAULT_CLASS = "default";

    public RateLimitProperties {
        trustedProxies = trustedProxies == null ? List.of() : List.copyOf(trustedProxies);
        classes = classes == null ? Map.of() : Map.copyOf(classes);
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    public record LimiterClass(
            @Min(1) int maxRequests,
            @NotNull Duration window
    ) {
    }

    public record Route(
            @NotBlank String method,
            @NotBlank String path,
            @NotBlank String limiterClass
    ) {
    }
}
