package com.amumal.backend.global.transaction;

import java.time.Duration;

import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * app.transaction.timeout: 원자 단위 하나에 허용되는 최대 시간 (기본 5초)
 */
@Validated
@ConfigurationProperties(prefix = "app.transaction")
public record TransactionProperties(
        @NotNull @DefaultValue("5s") Duration timeout
) {

    public int timeoutSeconds() {
        return (int) Math.max(1, timeout.toSeconds());
    }
}
